package com.techStack.sessionGuard.repository.attempt;

import com.techStack.sessionGuard.models.attempt.AttemptCounts;
import com.techStack.sessionGuard.models.attempt.LoginAttempt;
import com.techStack.sessionGuard.models.security.SubjectType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only record of login attempts per identifier and per IP.
 *
 * Expiry is enforced by time-bounded reads, never by deletion on write, so a
 * read of "attempts since T" is correct regardless of write ordering. Writes
 * are atomic per key and duplicates are tolerated.
 */
public interface AttemptLedger {

    /**
     * Appends the attempt to both the identifier ledger and the IP ledger.
     */
    Mono<Void> record(LoginAttempt attempt);

    /**
     * Failure counts since {@code windowStart}: identifier-scoped and IP-scoped.
     */
    Mono<AttemptCounts> countSince(String identifier, String ip, Instant windowStart);

    /**
     * Attempts of one subject since {@code windowStart}, oldest first.
     */
    Flux<LoginAttempt> recentAttempts(SubjectType subjectType, String subject, Instant windowStart);

    /**
     * Clears the identifier's history and the IP ledger entries that belong to it.
     */
    Mono<Void> clear(String identifier, String ip);

    /**
     * Removes entries older than {@code cutoff} from every ledger key. Returns
     * the number of entries removed.
     */
    Mono<Long> purgeBefore(Instant cutoff);
}
