package com.techStack.sessionGuard.service.observability;

import com.techStack.sessionGuard.models.session.SessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit Log Service
 *
 * Writes security events to the dedicated SECURITY_AUDIT logger and counts
 * them in Micrometer. Fail-open decisions go through here as well so that a
 * degraded store never blinds the audit trail.
 */
@Service
public class AuditLogService {

    private static final Logger logger = LoggerFactory.getLogger(AuditLogService.class);
    private static final Logger auditLogger = LoggerFactory.getLogger("SECURITY_AUDIT");

    private static final String EVENT_COUNTER = "security.audit.events";

    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AuditLogService(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /* =========================
       Security Events
       ========================= */

    /**
     * Logs a security event such as a lockout or a CAPTCHA challenge.
     * Policy denials are expected and logged at INFO.
     */
    public void logSecurityEvent(String eventType, String subject, Map<String, Object> details) {
        Map<String, Object> entry = baseEntry(eventType, subject);
        if (details != null) {
            entry.putAll(details);
        }
        auditLogger.info("{}", entry);
        count(eventType);
    }

    /**
     * Logs a check that degraded to its safe default because the store failed.
     */
    public void logFailOpen(String check, String subject, Throwable error) {
        Map<String, Object> entry = baseEntry("FAIL_OPEN", subject);
        entry.put("check", check);
        entry.put("error", error != null ? error.getClass().getSimpleName() + ": " + error.getMessage() : "unknown");
        auditLogger.error("{}", entry);
        count("FAIL_OPEN");
        meterRegistry.counter("security.fail_open", "check", check).increment();
    }

    /* =========================
       Session Events
       ========================= */

    /**
     * Records a session state transition. EXPIRED is passive, DESTROYED is
     * actor initiated; both are kept apart here.
     */
    public void logSessionTransition(SessionState state, String sessionId, String userId, String reason) {
        Map<String, Object> entry = baseEntry("SESSION_" + state.name(), userId);
        entry.put("sessionId", abbreviate(sessionId));
        if (reason != null) {
            entry.put("reason", reason);
        }
        auditLogger.info("{}", entry);
        count("SESSION_" + state.name());
    }

    /* =========================
       System Events
       ========================= */

    public void logSystemEvent(String eventType, String details) {
        Map<String, Object> entry = baseEntry(eventType, "system");
        entry.put("details", details);
        auditLogger.warn("{}", entry);
        count(eventType);
    }

    /* =========================
       Helpers
       ========================= */

    private Map<String, Object> baseEntry(String eventType, String subject) {
        Instant now = clock.instant();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("event", eventType);
        entry.put("subject", subject);
        entry.put("timestamp", now.toString());
        return entry;
    }

    private void count(String eventType) {
        try {
            Counter.builder(EVENT_COUNTER)
                    .tag("event", eventType)
                    .register(meterRegistry)
                    .increment();
        } catch (RuntimeException e) {
            logger.warn("Failed to record audit metric for {}: {}", eventType, e.getMessage());
        }
    }

    /**
     * Session ids are bearer credentials; only a prefix is logged.
     */
    public static String abbreviate(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        return sessionId.length() <= 8 ? "****" : sessionId.substring(0, 8) + "****";
    }
}
