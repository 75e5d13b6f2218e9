package com.techStack.sessionGuard.models.security;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Lockout verdict for a user identifier or an IP.
 *
 * The lock is derived from ledger state only. It holds for as long as the
 * window still contains enough failures and is never written anywhere.
 */
@Value
@Builder
public class LockoutStatus {

    String subject;
    SubjectType subjectType;
    boolean locked;
    LockoutReason reason;
    Instant lockedAt;
    Instant expiresAt;
    long attempts;
    int threshold;

    public static LockoutStatus notLocked(String subject, SubjectType subjectType, long attempts, int threshold) {
        return LockoutStatus.builder()
                .subject(subject)
                .subjectType(subjectType)
                .locked(false)
                .attempts(attempts)
                .threshold(threshold)
                .build();
    }

    public Duration remainingTime(Instant now) {
        if (!locked || expiresAt == null || !expiresAt.isAfter(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, expiresAt);
    }

    /**
     * Remaining lock time in whole minutes, rounded up.
     */
    public long remainingMinutes(Instant now) {
        long millis = remainingTime(now).toMillis();
        return (millis + 59_999) / 60_000;
    }
}
