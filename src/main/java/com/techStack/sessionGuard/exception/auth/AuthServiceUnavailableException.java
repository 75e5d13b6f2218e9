package com.techStack.sessionGuard.exception.auth;

import com.techStack.sessionGuard.exception.service.CustomException;
import org.springframework.http.HttpStatus;

/**
 * The user directory or credential check could not be reached.
 */
public class AuthServiceUnavailableException extends CustomException {

    public AuthServiceUnavailableException(Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "Authentication is temporarily unavailable",
                cause, "AUTH_SERVICE_UNAVAILABLE");
    }
}
