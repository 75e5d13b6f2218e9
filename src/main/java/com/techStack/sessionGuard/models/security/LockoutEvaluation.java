package com.techStack.sessionGuard.models.security;

import com.techStack.sessionGuard.models.attempt.AttemptCounts;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * All lockout checks for one request. Every field is computed; none short-circuits another.
 */
@Value
@Builder
public class LockoutEvaluation {
    LockoutStatus userLockout;
    LockoutStatus ipBlock;
    SuspicionScore suspicion;
    boolean captchaRequired;
    Duration progressiveDelay;
    AttemptCounts attempts;
}
