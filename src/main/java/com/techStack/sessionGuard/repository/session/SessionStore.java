package com.techStack.sessionGuard.repository.session;

import com.techStack.sessionGuard.models.session.Session;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Session records keyed by session id plus a per-user index of session ids.
 */
public interface SessionStore {

    /**
     * Writes the session with the given time-to-live and indexes it under its user.
     */
    Mono<Void> save(Session session, Duration ttl);

    Mono<Session> find(String sessionId);

    /**
     * Overwrites an existing record only. Emits false when the session is gone,
     * so a concurrently destroyed session is never resurrected.
     */
    Mono<Boolean> update(Session session, Duration ttl);

    /**
     * Deletes the record and its index entry. Emits true only for the caller
     * that actually removed it.
     */
    Mono<Boolean> delete(String sessionId, String userId);

    Flux<String> findSessionIds(String userId);

    Flux<Session> findAll();

    /**
     * Drops index entries whose session record no longer exists. Returns the number pruned.
     */
    Mono<Long> pruneIndexes();
}
