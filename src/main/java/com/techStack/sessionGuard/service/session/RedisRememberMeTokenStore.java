package com.techStack.sessionGuard.service.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.sessionGuard.config.StoreProperties;
import com.techStack.sessionGuard.models.session.RememberMeToken;
import com.techStack.sessionGuard.repository.session.RememberMeTokenStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static com.techStack.sessionGuard.constants.SecurityConstants.REMEMBER_ME_KEY_PREFIX;
import static com.techStack.sessionGuard.constants.SecurityConstants.USER_REMEMBER_ME_KEY_PREFIX;

/**
 * Redis Remember-Me Token Store
 *
 * {@code remember_me:{hash}} holds the token record, {@code user_remember_me:{userId}}
 * indexes the hashes of one user. Consumption is a single GETDEL.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisRememberMeTokenStore implements RememberMeTokenStore {

    private static final int SCAN_BATCH = 500;

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final StoreProperties storeProperties;

    @Override
    public Mono<Void> save(RememberMeToken token, Duration ttl) {
        String indexKey = userTokensKey(token.getUserId());

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(token))
                .flatMap(json -> redisTemplate.opsForValue().set(tokenKey(token.getTokenHash()), json, ttl))
                .then(redisTemplate.opsForZSet().add(indexKey, token.getTokenHash(),
                        token.getCreatedAt().toEpochMilli()))
                .then(redisTemplate.expire(indexKey, ttl))
                .timeout(storeProperties.getTimeout())
                .then();
    }

    @Override
    public Mono<RememberMeToken> find(String tokenHash) {
        return redisTemplate.opsForValue()
                .get(tokenKey(tokenHash))
                .timeout(storeProperties.getTimeout())
                .flatMap(this::deserialize);
    }

    @Override
    public Mono<RememberMeToken> consume(String tokenHash) {
        return redisTemplate.opsForValue()
                .getAndDelete(tokenKey(tokenHash))
                .timeout(storeProperties.getTimeout())
                .flatMap(this::deserialize)
                .flatMap(token -> redisTemplate.opsForZSet()
                        .remove(userTokensKey(token.getUserId()), tokenHash)
                        .thenReturn(token));
    }

    @Override
    public Mono<Boolean> delete(String tokenHash, String userId) {
        Mono<Long> index = userId != null
                ? redisTemplate.opsForZSet().remove(userTokensKey(userId), tokenHash)
                : Mono.just(0L);

        return redisTemplate.delete(tokenKey(tokenHash))
                .flatMap(deleted -> index.thenReturn(deleted > 0))
                .timeout(storeProperties.getTimeout());
    }

    @Override
    public Flux<RememberMeToken> findByUser(String userId) {
        return redisTemplate.opsForZSet()
                .range(userTokensKey(userId), Range.unbounded())
                .timeout(storeProperties.getTimeout())
                .flatMap(this::find);
    }

    @Override
    public Mono<Long> pruneIndexes() {
        return redisTemplate.scan(ScanOptions.scanOptions()
                        .match(USER_REMEMBER_ME_KEY_PREFIX + "*").count(SCAN_BATCH).build())
                .timeout(storeProperties.getTimeout())
                .flatMap(this::pruneIndex, 4)
                .reduce(0L, Long::sum);
    }

    private Mono<Long> pruneIndex(String indexKey) {
        return redisTemplate.opsForZSet()
                .range(indexKey, Range.unbounded())
                .filterWhen(hash -> redisTemplate.hasKey(tokenKey(hash)).map(exists -> !exists))
                .collectList()
                .flatMap(stale -> stale.isEmpty()
                        ? Mono.just(0L)
                        : redisTemplate.opsForZSet().remove(indexKey, stale.toArray()))
                .timeout(storeProperties.getTimeout());
    }

    static String tokenKey(String tokenHash) {
        return REMEMBER_ME_KEY_PREFIX + tokenHash;
    }

    static String userTokensKey(String userId) {
        return USER_REMEMBER_ME_KEY_PREFIX + userId;
    }

    private Mono<RememberMeToken> deserialize(String json) {
        try {
            return Mono.just(objectMapper.readValue(json, RememberMeToken.class));
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable remember-me record: {}", e.getOriginalMessage());
            return Mono.empty();
        }
    }
}
