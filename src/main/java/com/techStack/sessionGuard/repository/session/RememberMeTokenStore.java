package com.techStack.sessionGuard.repository.session;

import com.techStack.sessionGuard.models.session.RememberMeToken;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Remember-me tokens keyed by the hash of the raw token.
 */
public interface RememberMeTokenStore {

    Mono<Void> save(RememberMeToken token, Duration ttl);

    Mono<RememberMeToken> find(String tokenHash);

    /**
     * Reads and deletes in one step. Of two concurrent callers only one receives the token.
     */
    Mono<RememberMeToken> consume(String tokenHash);

    Mono<Boolean> delete(String tokenHash, String userId);

    Flux<RememberMeToken> findByUser(String userId);

    /**
     * Drops index entries of tokens that no longer exist. Returns the number pruned.
     */
    Mono<Long> pruneIndexes();
}
