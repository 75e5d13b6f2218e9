package com.techStack.sessionGuard.exception.auth;

import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.user.UserStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class AccountDisabledException extends CustomException {
    private final UserStatus accountStatus;

    public AccountDisabledException(UserStatus accountStatus) {
        super(HttpStatus.FORBIDDEN, "Account is not active", "ACCOUNT_DISABLED");
        this.accountStatus = accountStatus;
    }
}
