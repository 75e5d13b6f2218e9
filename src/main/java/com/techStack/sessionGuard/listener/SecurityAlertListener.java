package com.techStack.sessionGuard.listener;

import com.techStack.sessionGuard.event.AccountLockedEvent;
import com.techStack.sessionGuard.event.IpBlockedEvent;
import com.techStack.sessionGuard.models.security.LockoutStatus;
import com.techStack.sessionGuard.models.security.SecurityAlert;
import com.techStack.sessionGuard.models.security.SubjectType;
import com.techStack.sessionGuard.repository.notification.SecurityAlertNotifier;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Security Alert Listener
 *
 * Forwards lockout and IP-block events to the security alert notifier.
 * Delivery failures are audited and never reach the login request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityAlertListener {

    /* =========================
       Dependencies
       ========================= */

    private final SecurityAlertNotifier notifier;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /* =========================
       Event Handling
       ========================= */

    @Async
    @EventListener
    public void handleAccountLocked(AccountLockedEvent event) {
        log.warn("Account lockout reached for {} from {}",
                HelperUtils.maskIdentifier(event.getIdentifier()),
                HelperUtils.maskIpAddress(event.getIpAddress()));

        Map<String, Object> details = lockoutDetails(event.getLockout());
        details.put("ip", HelperUtils.maskIpAddress(event.getIpAddress()));

        dispatch(SecurityAlert.builder()
                .type("ACCOUNT_LOCKED")
                .subject(event.getIdentifier())
                .subjectType(SubjectType.USER)
                .occurredAt(clock.instant())
                .details(details)
                .build());
    }

    @Async
    @EventListener
    public void handleIpBlocked(IpBlockedEvent event) {
        log.warn("IP block reached for {}", HelperUtils.maskIpAddress(event.getIpAddress()));

        dispatch(SecurityAlert.builder()
                .type("IP_BLOCKED")
                .subject(event.getIpAddress())
                .subjectType(SubjectType.IP)
                .occurredAt(clock.instant())
                .details(lockoutDetails(event.getBlock()))
                .build());
    }

    /* =========================
       Helper Methods
       ========================= */

    private void dispatch(SecurityAlert alert) {
        Instant start = clock.instant();

        notifier.notify(alert)
                .doOnSuccess(v -> log.debug("{} alert delivered in {}",
                        alert.getType(), Duration.between(start, clock.instant())))
                .doOnError(e -> {
                    log.error("Failed to deliver {} alert: {}", alert.getType(), e.getMessage());
                    auditLogService.logSystemEvent(
                            alert.getType() + "_ALERT_FAILURE",
                            String.format("Alert delivery failed at %s: %s", clock.instant(), e.getMessage()));
                })
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    private Map<String, Object> lockoutDetails(LockoutStatus lockout) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (lockout != null) {
            details.put("attempts", lockout.getAttempts());
            details.put("lockedAt", String.valueOf(lockout.getLockedAt()));
            details.put("expiresAt", String.valueOf(lockout.getExpiresAt()));
        }
        return details;
    }
}
