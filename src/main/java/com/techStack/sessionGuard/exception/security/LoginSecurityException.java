package com.techStack.sessionGuard.exception.security;

import com.techStack.sessionGuard.exception.service.CustomException;
import org.springframework.http.HttpStatus;

/**
 * Failure of the login security pipeline itself.
 */
public class LoginSecurityException extends CustomException {

    public LoginSecurityException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause, "LOGIN_SECURITY_ERROR");
    }
}
