package com.techStack.sessionGuard.models.attempt;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Immutable ledger entry. The nonce keeps two attempts recorded in the
 * same millisecond distinct in the sorted sets.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LoginAttempt {
    String identifier;
    String ip;
    String userAgent;
    String deviceFingerprint;
    AttemptOutcome outcome;
    Instant timestamp;
    String nonce;
}
