package com.techStack.sessionGuard.service.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.sessionGuard.config.StoreProperties;
import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.repository.session.SessionStore;
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

import java.time.Duration;
import java.util.List;

import static com.techStack.sessionGuard.constants.SecurityConstants.SESSION_KEY_PREFIX;
import static com.techStack.sessionGuard.constants.SecurityConstants.USER_SESSIONS_KEY_PREFIX;

/**
 * Redis Session Store
 *
 * {@code session:{id}} holds the JSON record with its TTL,
 * {@code user_sessions:{userId}} is a sorted set of ids scored by creation time.
 * Record and index are written and deleted together by script.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisSessionStore implements SessionStore {

    static final RedisScript<Long> SAVE_SCRIPT =
            RedisScript.of(new ClassPathResource("scripts/save_session.lua"), Long.class);
    static final RedisScript<Long> DELETE_SCRIPT =
            RedisScript.of(new ClassPathResource("scripts/delete_session.lua"), Long.class);

    private static final int SCAN_BATCH = 500;

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final StoreProperties storeProperties;

    /* =========================
       Writes
       ========================= */

    @Override
    public Mono<Void> save(Session session, Duration ttl) {
        return Mono.fromCallable(() -> serialize(session))
                .flatMap(json -> redisTemplate.execute(
                                SAVE_SCRIPT,
                                List.of(sessionKey(session.getSessionId()), userSessionsKey(session.getUserId())),
                                List.of(json,
                                        String.valueOf(positive(ttl).toMillis()),
                                        session.getSessionId(),
                                        String.valueOf(session.getCreatedAt().toEpochMilli())))
                        .next())
                .timeout(storeProperties.getTimeout())
                .then();
    }

    @Override
    public Mono<Boolean> update(Session session, Duration ttl) {
        return Mono.fromCallable(() -> serialize(session))
                .flatMap(json -> redisTemplate.opsForValue()
                        .setIfPresent(sessionKey(session.getSessionId()), json, positive(ttl)))
                .defaultIfEmpty(false)
                .timeout(storeProperties.getTimeout());
    }

    @Override
    public Mono<Boolean> delete(String sessionId, String userId) {
        return redisTemplate.execute(
                        DELETE_SCRIPT,
                        List.of(sessionKey(sessionId), userSessionsKey(userId)),
                        List.of(sessionId))
                .next()
                .map(deleted -> deleted > 0)
                .defaultIfEmpty(false)
                .timeout(storeProperties.getTimeout());
    }

    /* =========================
       Reads
       ========================= */

    @Override
    public Mono<Session> find(String sessionId) {
        return redisTemplate.opsForValue()
                .get(sessionKey(sessionId))
                .timeout(storeProperties.getTimeout())
                .flatMap(this::deserialize);
    }

    @Override
    public Flux<String> findSessionIds(String userId) {
        return redisTemplate.opsForZSet()
                .range(userSessionsKey(userId), Range.unbounded())
                .timeout(storeProperties.getTimeout());
    }

    @Override
    public Flux<Session> findAll() {
        return scanKeys(SESSION_KEY_PREFIX)
                .flatMap(key -> redisTemplate.opsForValue().get(key)
                        .timeout(storeProperties.getTimeout()), 16)
                .flatMap(this::deserialize);
    }

    /* =========================
       Maintenance
       ========================= */

    @Override
    public Mono<Long> pruneIndexes() {
        return scanKeys(USER_SESSIONS_KEY_PREFIX)
                .flatMap(this::pruneIndex, 4)
                .reduce(0L, Long::sum);
    }

    private Mono<Long> pruneIndex(String indexKey) {
        return redisTemplate.opsForZSet()
                .range(indexKey, Range.unbounded())
                .filterWhen(sessionId -> redisTemplate.hasKey(sessionKey(sessionId)).map(exists -> !exists))
                .collectList()
                .flatMap(stale -> stale.isEmpty()
                        ? Mono.just(0L)
                        : redisTemplate.opsForZSet().remove(indexKey, stale.toArray()))
                .timeout(storeProperties.getTimeout());
    }

    /* =========================
       Helpers
       ========================= */

    static String sessionKey(String sessionId) {
        return SESSION_KEY_PREFIX + sessionId;
    }

    static String userSessionsKey(String userId) {
        return USER_SESSIONS_KEY_PREFIX + userId;
    }

    /** The timeout bounds the wait for each scanned key, not the whole scan. */
    private Flux<String> scanKeys(String prefix) {
        return redisTemplate.scan(ScanOptions.scanOptions().match(prefix + "*").count(SCAN_BATCH).build())
                .timeout(storeProperties.getTimeout());
    }

    private static Duration positive(Duration ttl) {
        return ttl == null || ttl.isNegative() || ttl.isZero() ? Duration.ofMillis(1) : ttl;
    }

    private String serialize(Session session) throws JsonProcessingException {
        return objectMapper.writeValueAsString(session);
    }

    private Mono<Session> deserialize(String json) {
        try {
            return Mono.just(objectMapper.readValue(json, Session.class));
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable session record: {}", e.getOriginalMessage());
            return Mono.empty();
        }
    }
}
