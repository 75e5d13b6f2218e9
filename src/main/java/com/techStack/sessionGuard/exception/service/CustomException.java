package com.techStack.sessionGuard.exception.service;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of every error the API renders itself: an HTTP status plus the
 * stable {@code code} clients switch on.
 */
@Getter
public abstract class CustomException extends RuntimeException {
    private final HttpStatus status;
    private final String code;

    protected CustomException(HttpStatus status, String message, String code) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected CustomException(HttpStatus status, String message, Throwable cause, String code) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
