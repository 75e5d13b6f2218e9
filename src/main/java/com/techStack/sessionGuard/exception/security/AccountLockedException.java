package com.techStack.sessionGuard.exception.security;

import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.security.LockoutStatus;
import com.techStack.sessionGuard.models.security.SecurityContext;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class AccountLockedException extends CustomException {
    private final LockoutStatus lockout;
    private final SecurityContext securityContext;

    public AccountLockedException(LockoutStatus lockout, SecurityContext securityContext) {
        super(HttpStatus.LOCKED,
                "Account temporarily locked due to too many failed login attempts", "ACCOUNT_LOCKED");
        this.lockout = lockout;
        this.securityContext = securityContext;
    }
}
