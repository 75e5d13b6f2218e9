package com.techStack.sessionGuard.exception.session;

import com.techStack.sessionGuard.exception.service.CustomException;
import org.springframework.http.HttpStatus;

/**
 * Session store write failures that must not be swallowed.
 */
public class SessionException extends CustomException {

    public SessionException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause, "SESSION_CREATION_FAILED");
    }
}
