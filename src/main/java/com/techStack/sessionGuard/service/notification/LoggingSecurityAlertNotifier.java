package com.techStack.sessionGuard.service.notification;

import com.techStack.sessionGuard.models.security.SecurityAlert;
import com.techStack.sessionGuard.models.security.SubjectType;
import com.techStack.sessionGuard.repository.notification.SecurityAlertNotifier;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Writes alerts to the security audit trail.
 */
@Service
@RequiredArgsConstructor
public class LoggingSecurityAlertNotifier implements SecurityAlertNotifier {

    private final AuditLogService auditLogService;

    @Override
    public Mono<Void> notify(SecurityAlert alert) {
        return Mono.fromRunnable(() -> {
            String subject = alert.getSubjectType() == SubjectType.IP
                    ? HelperUtils.maskIpAddress(alert.getSubject())
                    : HelperUtils.maskIdentifier(alert.getSubject());
            auditLogService.logSecurityEvent("ALERT_" + alert.getType(), subject, alert.getDetails());
        });
    }
}
