package com.techStack.sessionGuard.models.security;

import lombok.Value;

import java.time.Instant;

@Value
public class RateLimitDecision {
    boolean allowed;
    int limit;
    long remaining;
    Instant resetAt;
}
