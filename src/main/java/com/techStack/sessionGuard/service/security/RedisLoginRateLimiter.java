package com.techStack.sessionGuard.service.security;

import com.techStack.sessionGuard.config.RateLimitProperties;
import com.techStack.sessionGuard.config.StoreProperties;
import com.techStack.sessionGuard.models.security.RateLimitDecision;
import com.techStack.sessionGuard.repository.security.LoginRateLimiter;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.techStack.sessionGuard.constants.SecurityConstants.LOGIN_RATE_LIMIT_KEY_PREFIX;

/**
 * Redis Login Rate Limiter
 *
 * Sliding window over {@code login_rate_limit:{ip}}. Trim, count, admit and
 * expire run as one script, so parallel requests cannot overshoot the limit.
 * A rejected request does not occupy a slot.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisLoginRateLimiter implements LoginRateLimiter {

    /** Replies {@code [admitted, count, oldestMillis]}. */
    @SuppressWarnings("unchecked")
    static final RedisScript<List<Long>> SLIDING_WINDOW_SCRIPT = RedisScript.of(
            new ClassPathResource("scripts/sliding_window.lua"), (Class<List<Long>>) (Class<?>) List.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RateLimitProperties properties;
    private final StoreProperties storeProperties;
    private final Clock clock;

    @Override
    public Mono<RateLimitDecision> tryAcquire(String ip) {
        Instant now = clock.instant();
        long windowMillis = properties.getWindow().toMillis();
        int limit = properties.getMaxRequests();
        String member = now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);

        return redisTemplate.execute(
                        SLIDING_WINDOW_SCRIPT,
                        List.of(key(ip)),
                        List.of(String.valueOf(now.toEpochMilli()),
                                String.valueOf(windowMillis),
                                String.valueOf(limit),
                                member))
                .next()
                .timeout(storeProperties.getTimeout())
                .map(result -> toDecision(ip, result, limit, windowMillis, now));
    }

    private RateLimitDecision toDecision(String ip, List<?> result, int limit, long windowMillis, Instant now) {
        boolean admitted = asLong(result, 0, 1L) == 1L;
        long count = asLong(result, 1, 0L);
        long oldest = asLong(result, 2, now.toEpochMilli());

        Instant resetAt = Instant.ofEpochMilli(oldest + windowMillis);
        long remaining = Math.max(0, limit - count);

        if (!admitted) {
            log.debug("Login rate limit reached for {} ({} of {})", HelperUtils.maskIpAddress(ip), count, limit);
        }
        return new RateLimitDecision(admitted, limit, remaining, resetAt);
    }

    private static long asLong(List<?> values, int index, long fallback) {
        if (values == null || values.size() <= index || values.get(index) == null) {
            return fallback;
        }
        Object value = values.get(index);
        return value instanceof Number number ? number.longValue() : Long.parseLong(value.toString());
    }

    static String key(String ip) {
        return LOGIN_RATE_LIMIT_KEY_PREFIX + ip;
    }
}
