package com.techStack.sessionGuard.support;

import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.repository.session.SessionStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store backed by maps. Records carry a TTL measured against the
 * supplied clock, so expired records disappear the way Redis keys do.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, Instant> expiries = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userIndex = new ConcurrentHashMap<>();
    private final Clock clock;

    private RuntimeException readFailure;
    private RuntimeException writeFailure;

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    public void failReadsWith(RuntimeException failure) {
        this.readFailure = failure;
    }

    public void failWritesWith(RuntimeException failure) {
        this.writeFailure = failure;
    }

    /**
     * Stores a record as is, bypassing TTL handling. Lets tests plant
     * records whose key has outlived the session's own expiry.
     */
    public void put(Session session) {
        sessions.put(session.getSessionId(), session);
        expiries.remove(session.getSessionId());
        userIndex.computeIfAbsent(session.getUserId(), id -> new LinkedHashSet<>()).add(session.getSessionId());
    }

    public boolean contains(String sessionId) {
        return live(sessionId) != null;
    }

    public Set<String> indexOf(String userId) {
        return userIndex.computeIfAbsent(userId, id -> new LinkedHashSet<>());
    }

    @Override
    public Mono<Void> save(Session session, Duration ttl) {
        if (writeFailure != null) {
            return Mono.error(writeFailure);
        }
        return Mono.fromRunnable(() -> {
            sessions.put(session.getSessionId(), session);
            expiries.put(session.getSessionId(), clock.instant().plus(ttl));
            userIndex.computeIfAbsent(session.getUserId(), id -> new LinkedHashSet<>()).add(session.getSessionId());
        });
    }

    @Override
    public Mono<Session> find(String sessionId) {
        if (readFailure != null) {
            return Mono.error(readFailure);
        }
        return Mono.fromCallable(() -> live(sessionId));
    }

    @Override
    public Mono<Boolean> update(Session session, Duration ttl) {
        if (writeFailure != null) {
            return Mono.error(writeFailure);
        }
        return Mono.fromCallable(() -> {
            if (live(session.getSessionId()) == null) {
                return false;
            }
            sessions.put(session.getSessionId(), session);
            expiries.put(session.getSessionId(), clock.instant().plus(ttl));
            return true;
        });
    }

    @Override
    public Mono<Boolean> delete(String sessionId, String userId) {
        if (writeFailure != null) {
            return Mono.error(writeFailure);
        }
        return Mono.fromCallable(() -> {
            indexOf(userId).remove(sessionId);
            expiries.remove(sessionId);
            return sessions.remove(sessionId) != null;
        });
    }

    @Override
    public Flux<String> findSessionIds(String userId) {
        if (readFailure != null) {
            return Flux.error(readFailure);
        }
        return Flux.fromIterable(Set.copyOf(indexOf(userId)));
    }

    @Override
    public Flux<Session> findAll() {
        if (readFailure != null) {
            return Flux.error(readFailure);
        }
        return Flux.fromIterable(Set.copyOf(sessions.keySet()))
                .flatMap(id -> Mono.justOrEmpty(live(id)));
    }

    @Override
    public Mono<Long> pruneIndexes() {
        return Mono.fromCallable(() -> {
            long pruned = 0;
            for (Set<String> ids : userIndex.values()) {
                for (String id : Set.copyOf(ids)) {
                    if (live(id) == null) {
                        ids.remove(id);
                        pruned++;
                    }
                }
            }
            return pruned;
        });
    }

    private Session live(String sessionId) {
        Instant expiry = expiries.get(sessionId);
        if (expiry != null && !expiry.isAfter(clock.instant())) {
            sessions.remove(sessionId);
            expiries.remove(sessionId);
            return null;
        }
        return sessions.get(sessionId);
    }
}
