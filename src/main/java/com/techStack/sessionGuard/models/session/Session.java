package com.techStack.sessionGuard.models.session;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * Session record as stored under {@code session:{sessionId}}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Session {

    String sessionId;
    String userId;
    String ipAddress;
    String userAgent;
    String deviceFingerprint;
    Instant createdAt;
    Instant lastActivity;
    Instant expiresAt;
    long maxAgeMillis;
    LoginType loginType;
    SecurityLevel securityLevel;
    boolean rememberMe;

    public boolean isExpired(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    public Duration remainingTtl(Instant now) {
        return isExpired(now) ? Duration.ZERO : Duration.between(now, expiresAt);
    }
}
