package com.techStack.sessionGuard.event;

import com.techStack.sessionGuard.models.security.LockoutStatus;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a recorded failure brings an identifier to the lockout threshold.
 */
@Getter
public class AccountLockedEvent extends ApplicationEvent {
    private final String identifier;
    private final String ipAddress;
    private final LockoutStatus lockout;

    public AccountLockedEvent(Object source, String identifier, String ipAddress, LockoutStatus lockout) {
        super(source);
        this.identifier = identifier;
        this.ipAddress = ipAddress;
        this.lockout = lockout;
    }
}
