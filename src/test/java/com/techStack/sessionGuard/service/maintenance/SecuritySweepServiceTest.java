package com.techStack.sessionGuard.service.maintenance;

import com.techStack.sessionGuard.config.LoginSecurityProperties;
import com.techStack.sessionGuard.models.attempt.AttemptOutcome;
import com.techStack.sessionGuard.models.attempt.LoginAttempt;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.service.session.SessionManager;
import com.techStack.sessionGuard.support.InMemoryAttemptLedger;
import com.techStack.sessionGuard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SecuritySweepServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SessionManager sessionManager;
    @Mock
    private AuditLogService auditLogService;

    private InMemoryAttemptLedger ledger;
    private SecuritySweepService sweepService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ledger = new InMemoryAttemptLedger();
        LoginSecurityProperties properties = new LoginSecurityProperties();
        properties.setRetention(Duration.ofHours(1));
        sweepService = new SecuritySweepService(sessionManager, ledger, properties, auditLogService,
                new MutableClock(NOW));
    }

    @Test
    void sweep_prunesIndexesAndOldLedgerEntries() {
        ledger.record(attempt(NOW.minus(Duration.ofHours(2)))).block();
        ledger.record(attempt(NOW.minus(Duration.ofMinutes(90)))).block();
        ledger.record(attempt(NOW.minus(Duration.ofMinutes(10)))).block();
        when(sessionManager.cleanupExpiredSessions()).thenReturn(Mono.just(3L));

        StepVerifier.create(sweepService.runSweep())
                .assertNext(report -> {
                    assertThat(report.getIndexEntriesPruned()).isEqualTo(3L);
                    assertThat(report.getLedgerEntriesPurged()).isEqualTo(2L);
                    assertThat(report.getCompletedAt()).isEqualTo(NOW);
                })
                .verifyComplete();

        assertThat(ledger.all()).hasSize(1);
        verify(auditLogService).logSystemEvent("SECURITY_SWEEP", "indexes=3, ledger=2");
    }

    @Test
    void indexFailure_stillPurgesLedger() {
        ledger.record(attempt(NOW.minus(Duration.ofHours(2)))).block();
        when(sessionManager.cleanupExpiredSessions()).thenReturn(Mono.error(new IllegalStateException("redis down")));

        StepVerifier.create(sweepService.runSweep())
                .assertNext(report -> {
                    assertThat(report.getIndexEntriesPruned()).isZero();
                    assertThat(report.getLedgerEntriesPurged()).isEqualTo(1L);
                })
                .verifyComplete();
    }

    @Test
    void ledgerFailure_stillReports() {
        ledger.failWith(new IllegalStateException("redis down"));
        when(sessionManager.cleanupExpiredSessions()).thenReturn(Mono.just(0L));

        StepVerifier.create(sweepService.runSweep())
                .assertNext(report -> assertThat(report.getLedgerEntriesPurged()).isZero())
                .verifyComplete();
    }

    private static LoginAttempt attempt(Instant timestamp) {
        return LoginAttempt.builder()
                .identifier("jane@example.com")
                .ip("203.0.113.7")
                .outcome(AttemptOutcome.INVALID_CREDENTIALS)
                .timestamp(timestamp)
                .nonce(timestamp.toString())
                .build();
    }
}
