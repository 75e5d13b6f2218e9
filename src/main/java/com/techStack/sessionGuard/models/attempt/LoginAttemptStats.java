package com.techStack.sessionGuard.models.attempt;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginAttemptStats {
    String identifier;
    String ip;
    long userAttempts;
    long ipAttempts;
    int maxAttempts;
    int ipMaxAttempts;
    long remainingAttempts;
    Instant windowStart;
    Instant lastAttemptAt;
    boolean userLocked;
    boolean ipBlocked;
    boolean captchaRequired;
}
