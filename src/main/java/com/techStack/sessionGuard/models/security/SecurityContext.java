package com.techStack.sessionGuard.models.security;

import com.techStack.sessionGuard.models.attempt.AttemptCounts;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Login Security Context
 *
 * Result of one gate evaluation, passed along the login call chain and
 * rendered into the X-* security headers. Immutable.
 */
@Value
@Builder(toBuilder = true)
public class SecurityContext {

    boolean enabled;
    String identifier;
    String ip;
    String userAgent;
    String deviceFingerprint;
    LockoutStatus userLockout;
    LockoutStatus ipBlock;
    SuspicionScore suspicion;
    boolean captchaRequired;
    Duration progressiveDelay;
    AttemptCounts attempts;
    Instant evaluatedAt;

    public static SecurityContext disabled(String identifier, String ip, Instant now) {
        return SecurityContext.builder()
                .enabled(false)
                .identifier(identifier)
                .ip(ip)
                .suspicion(SuspicionScore.clean())
                .progressiveDelay(Duration.ZERO)
                .attempts(AttemptCounts.empty())
                .evaluatedAt(now)
                .build();
    }

    public boolean isUserLocked() {
        return userLockout != null && userLockout.isLocked();
    }

    public boolean isIpBlocked() {
        return ipBlock != null && ipBlock.isLocked();
    }

    public boolean isSuspicious() {
        return suspicion != null && suspicion.isSuspicious();
    }

    public long getProgressiveDelayMillis() {
        return progressiveDelay != null ? progressiveDelay.toMillis() : 0L;
    }
}
