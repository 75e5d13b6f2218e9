package com.techStack.sessionGuard.event;

import com.techStack.sessionGuard.models.security.LockoutStatus;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class IpBlockedEvent extends ApplicationEvent {
    private final String ipAddress;
    private final LockoutStatus block;

    public IpBlockedEvent(Object source, String ipAddress, LockoutStatus block) {
        super(source);
        this.ipAddress = ipAddress;
        this.block = block;
    }
}
