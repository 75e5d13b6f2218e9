package com.techStack.sessionGuard.exception.session;

import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.session.SecurityLevel;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InsufficientSecurityLevelException extends CustomException {
    private final SecurityLevel requiredLevel;
    private final SecurityLevel currentLevel;

    public InsufficientSecurityLevelException(SecurityLevel requiredLevel, SecurityLevel currentLevel) {
        super(HttpStatus.FORBIDDEN,
                "Higher security level required for this operation", "INSUFFICIENT_SECURITY_LEVEL");
        this.requiredLevel = requiredLevel;
        this.currentLevel = currentLevel;
    }
}
