package com.techStack.sessionGuard.models.session;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Stored remember-me credential. Only the SHA-256 hash of the cookie value is kept.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RememberMeToken {

    String tokenHash;
    String userId;
    String lineageId;
    String sessionId;
    String deviceFingerprint;
    Instant createdAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }
}
