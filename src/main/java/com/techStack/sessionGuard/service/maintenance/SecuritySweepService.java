package com.techStack.sessionGuard.service.maintenance;

import com.techStack.sessionGuard.config.LoginSecurityProperties;
import com.techStack.sessionGuard.models.session.SweepReport;
import com.techStack.sessionGuard.repository.attempt.AttemptLedger;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.service.session.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Security Sweep Service
 *
 * Periodic housekeeping: prunes session and remember-me index entries whose
 * records have expired and purges ledger entries older than the retention.
 * Correctness never depends on it; key TTLs and window filters already hide
 * stale data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecuritySweepService {

    private final SessionManager sessionManager;
    private final AttemptLedger attemptLedger;
    private final LoginSecurityProperties loginSecurityProperties;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Scheduled(cron = "${security.cleanup.cron:0 */15 * * * *}")
    public void scheduledSweep() {
        runSweep()
                .doOnError(e -> log.error("Security sweep failed: {}", e.getMessage(), e))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    public Mono<SweepReport> runSweep() {
        Instant start = clock.instant();
        Instant cutoff = start.minus(loginSecurityProperties.getRetention());

        Mono<Long> indexes = sessionManager.cleanupExpiredSessions()
                .onErrorResume(e -> {
                    log.warn("Index pruning failed: {}", e.getMessage());
                    return Mono.just(0L);
                });
        Mono<Long> ledger = attemptLedger.purgeBefore(cutoff)
                .onErrorResume(e -> {
                    log.warn("Ledger purge failed: {}", e.getMessage());
                    return Mono.just(0L);
                });

        return Mono.zip(indexes, ledger)
                .map(counts -> {
                    Instant end = clock.instant();
                    return new SweepReport(counts.getT1(), counts.getT2(), end, Duration.between(start, end));
                })
                .doOnNext(report -> {
                    log.info("Security sweep pruned {} index entries and {} ledger entries in {}",
                            report.getIndexEntriesPruned(), report.getLedgerEntriesPurged(), report.getDuration());
                    auditLogService.logSystemEvent("SECURITY_SWEEP",
                            "indexes=" + report.getIndexEntriesPruned() + ", ledger=" + report.getLedgerEntriesPurged());
                });
    }
}
