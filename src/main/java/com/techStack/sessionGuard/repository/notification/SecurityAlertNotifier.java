package com.techStack.sessionGuard.repository.notification;

import com.techStack.sessionGuard.models.security.SecurityAlert;
import reactor.core.publisher.Mono;

/**
 * Outbound channel for security alerts (lockouts, IP blocks).
 */
public interface SecurityAlertNotifier {

    Mono<Void> notify(SecurityAlert alert);
}
