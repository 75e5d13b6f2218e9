package com.techStack.sessionGuard.repository.security;

import com.techStack.sessionGuard.models.security.RateLimitDecision;
import reactor.core.publisher.Mono;

/**
 * Sliding-window request counter keyed by client IP.
 */
public interface LoginRateLimiter {

    Mono<RateLimitDecision> tryAcquire(String ip);
}
