package com.techStack.sessionGuard.exception.security;

import com.techStack.sessionGuard.exception.service.CustomException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.time.Instant;

@Getter
public class RateLimitExceededException extends CustomException {
    private final int limit;
    private final Duration window;
    private final Instant resetAt;
    private final long retryAfterSeconds;

    public RateLimitExceededException(int limit, Duration window, Instant resetAt, long retryAfterSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS,
                "Too many login attempts from this IP. Please try again later", "RATE_LIMIT_EXCEEDED");
        this.limit = limit;
        this.window = window;
        this.resetAt = resetAt;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
