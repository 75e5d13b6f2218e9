package com.techStack.sessionGuard.service.attempt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.sessionGuard.config.LoginSecurityProperties;
import com.techStack.sessionGuard.config.StoreProperties;
import com.techStack.sessionGuard.models.attempt.AttemptCounts;
import com.techStack.sessionGuard.models.attempt.LoginAttempt;
import com.techStack.sessionGuard.models.security.SubjectType;
import com.techStack.sessionGuard.repository.attempt.AttemptLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.techStack.sessionGuard.constants.SecurityConstants.IP_ATTEMPTS_KEY_PREFIX;
import static com.techStack.sessionGuard.constants.SecurityConstants.LOGIN_ATTEMPTS_KEY_PREFIX;

/**
 * Redis Attempt Ledger
 *
 * Keeps two sorted sets per attempt: {@code login_attempts:{identifier}} and
 * {@code ip_attempts:{ip}}. Members are the JSON attempt, scores the epoch
 * millis. Each append is one script per key, so concurrent failures for the
 * same identifier never lose an update.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisAttemptLedger implements AttemptLedger {

    static final RedisScript<Long> APPEND_SCRIPT =
            RedisScript.of(new ClassPathResource("scripts/append_attempt.lua"), Long.class);
    static final RedisScript<Long> REMOVE_IDENTIFIER_SCRIPT =
            RedisScript.of(new ClassPathResource("scripts/remove_identifier_attempts.lua"), Long.class);

    private static final int SCAN_BATCH = 500;

    /* =========================
       Dependencies
       ========================= */

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final LoginSecurityProperties properties;
    private final StoreProperties storeProperties;

    /* =========================
       Writes
       ========================= */

    @Override
    public Mono<Void> record(LoginAttempt attempt) {
        return Mono.fromCallable(() -> serialize(withNonce(attempt)))
                .flatMap(member -> {
                    String score = String.valueOf(attempt.getTimestamp().toEpochMilli());
                    String ttl = String.valueOf(properties.getRetention().toMillis());

                    Mono<Long> identifierAppend = append(identifierKey(attempt.getIdentifier()), score, member, ttl);
                    Mono<Long> ipAppend = append(ipKey(attempt.getIp()), score, member, ttl);

                    return Mono.when(identifierAppend, ipAppend);
                })
                .timeout(storeProperties.getTimeout())
                .doOnSuccess(v -> log.debug("Recorded {} attempt for ledger keys of {}",
                        attempt.getOutcome().getValue(), attempt.getIp()));
    }

    private Mono<Long> append(String key, String score, String member, String ttl) {
        return redisTemplate.execute(APPEND_SCRIPT, List.of(key), List.of(score, member, ttl))
                .next();
    }

    @Override
    public Mono<Void> clear(String identifier, String ip) {
        Mono<Long> identifierCleared = redisTemplate.delete(identifierKey(identifier));
        Mono<Long> ipCleared = redisTemplate
                .execute(REMOVE_IDENTIFIER_SCRIPT, List.of(ipKey(ip)), List.of(identifier))
                .next()
                .defaultIfEmpty(0L);

        return Mono.zip(identifierCleared, ipCleared)
                .timeout(storeProperties.getTimeout())
                .doOnNext(result -> log.debug("Cleared attempt history: identifier keys {}, ip entries {}",
                        result.getT1(), result.getT2()))
                .then();
    }

    /* =========================
       Reads
       ========================= */

    @Override
    public Mono<AttemptCounts> countSince(String identifier, String ip, Instant windowStart) {
        Mono<Long> identifierFailures = countFailures(identifierKey(identifier), windowStart);
        Mono<Long> ipFailures = countFailures(ipKey(ip), windowStart);

        return Mono.zip(identifierFailures, ipFailures)
                .map(tuple -> new AttemptCounts(tuple.getT1(), tuple.getT2()));
    }

    private Mono<Long> countFailures(String key, Instant windowStart) {
        return readSince(key, windowStart)
                .filter(attempt -> attempt.getOutcome() != null && attempt.getOutcome().isFailure())
                .count();
    }

    @Override
    public Flux<LoginAttempt> recentAttempts(SubjectType subjectType, String subject, Instant windowStart) {
        String key = subjectType == SubjectType.IP ? ipKey(subject) : identifierKey(subject);
        return readSince(key, windowStart);
    }

    private Flux<LoginAttempt> readSince(String key, Instant windowStart) {
        Range<Double> range = Range.rightUnbounded(Range.Bound.inclusive((double) windowStart.toEpochMilli()));

        return redisTemplate.opsForZSet()
                .rangeByScore(key, range)
                .timeout(storeProperties.getTimeout())
                .flatMap(this::deserialize);
    }

    /* =========================
       Maintenance
       ========================= */

    @Override
    public Mono<Long> purgeBefore(Instant cutoff) {
        Range<Double> expired = Range.of(
                Range.Bound.unbounded(),
                Range.Bound.exclusive((double) cutoff.toEpochMilli()));

        return Flux.concat(scanKeys(LOGIN_ATTEMPTS_KEY_PREFIX), scanKeys(IP_ATTEMPTS_KEY_PREFIX))
                .flatMap(key -> redisTemplate.opsForZSet().removeRangeByScore(key, expired)
                        .timeout(storeProperties.getTimeout()), 8)
                .reduce(0L, Long::sum);
    }

    private Flux<String> scanKeys(String prefix) {
        return redisTemplate.scan(ScanOptions.scanOptions().match(prefix + "*").count(SCAN_BATCH).build())
                .timeout(storeProperties.getTimeout());
    }

    /* =========================
       Helpers
       ========================= */

    static String identifierKey(String identifier) {
        return LOGIN_ATTEMPTS_KEY_PREFIX + identifier;
    }

    static String ipKey(String ip) {
        return IP_ATTEMPTS_KEY_PREFIX + ip;
    }

    private LoginAttempt withNonce(LoginAttempt attempt) {
        return attempt.getNonce() != null
                ? attempt
                : attempt.toBuilder().nonce(UUID.randomUUID().toString().substring(0, 8)).build();
    }

    private String serialize(LoginAttempt attempt) throws JsonProcessingException {
        return objectMapper.writeValueAsString(attempt);
    }

    private Mono<LoginAttempt> deserialize(String member) {
        try {
            return Mono.just(objectMapper.readValue(member, LoginAttempt.class));
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable ledger entry: {}", e.getOriginalMessage());
            return Mono.empty();
        }
    }
}
