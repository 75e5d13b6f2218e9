package com.techStack.sessionGuard.exception.auth;

import com.techStack.sessionGuard.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class InvalidCredentialsException extends CustomException {

    public InvalidCredentialsException() {
        super(HttpStatus.UNAUTHORIZED, "Invalid credentials", "INVALID_CREDENTIALS");
    }
}
