package com.techStack.sessionGuard.exception.security;

import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.security.LockoutStatus;
import com.techStack.sessionGuard.models.security.SecurityContext;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class IpBlockedException extends CustomException {
    private final LockoutStatus block;
    private final SecurityContext securityContext;

    public IpBlockedException(LockoutStatus block, SecurityContext securityContext) {
        super(HttpStatus.LOCKED,
                "IP address temporarily blocked due to suspicious activity", "IP_BLOCKED");
        this.block = block;
        this.securityContext = securityContext;
    }
}
