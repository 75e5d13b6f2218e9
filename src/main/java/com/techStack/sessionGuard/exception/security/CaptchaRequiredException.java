package com.techStack.sessionGuard.exception.security;

import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.security.SecurityContext;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class CaptchaRequiredException extends CustomException {
    private final SecurityContext securityContext;
    private final boolean tokenPresented;

    public CaptchaRequiredException(SecurityContext securityContext, boolean tokenPresented) {
        super(HttpStatus.TOO_MANY_REQUESTS,
                tokenPresented
                        ? "CAPTCHA verification failed. Please try again"
                        : "Please complete CAPTCHA verification",
                "CAPTCHA_REQUIRED");
        this.securityContext = securityContext;
        this.tokenPresented = tokenPresented;
    }
}
