package com.techStack.sessionGuard.exception.security;

import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.security.SecurityContext;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

@Getter
public class SecurityValidationException extends CustomException {
    private final List<String> violations;
    private final int riskScore;
    private final SecurityContext securityContext;

    public SecurityValidationException(List<String> violations, int riskScore, SecurityContext securityContext) {
        super(HttpStatus.FORBIDDEN,
                "Request blocked due to security concerns", "SECURITY_VALIDATION_FAILED");
        this.violations = List.copyOf(violations);
        this.riskScore = riskScore;
        this.securityContext = securityContext;
    }
}
