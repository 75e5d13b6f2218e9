package com.techStack.sessionGuard.service.security;

import com.techStack.sessionGuard.config.LoginSecurityProperties;
import com.techStack.sessionGuard.models.attempt.AttemptCounts;
import com.techStack.sessionGuard.models.attempt.LoginAttempt;
import com.techStack.sessionGuard.models.attempt.LoginAttemptStats;
import com.techStack.sessionGuard.models.security.LockoutEvaluation;
import com.techStack.sessionGuard.models.security.LockoutReason;
import com.techStack.sessionGuard.models.security.LockoutStatus;
import com.techStack.sessionGuard.models.security.SubjectType;
import com.techStack.sessionGuard.models.security.SuspicionScore;
import com.techStack.sessionGuard.repository.attempt.AttemptLedger;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Lockout Evaluator
 *
 * Decides from ledger state alone whether an identifier is locked, an IP is
 * blocked, a CAPTCHA is due, how suspicious the attempt looks and how long to
 * delay it. Nothing here writes; a lock lasts exactly as long as the window
 * holds enough failures.
 *
 * Every check fails open on its own: a store error yields "not locked",
 * "not required" or "no delay" and is written to the security audit log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LockoutEvaluator {

    private static final int MAX_DELAY_EXPONENT = 30;

    /* =========================
       Dependencies
       ========================= */

    private final AttemptLedger attemptLedger;
    private final SuspiciousPatternDetector patternDetector;
    private final LoginSecurityProperties properties;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /* =========================
       Individual Checks
       ========================= */

    public Mono<LockoutStatus> isUserLockedOut(String identifier) {
        Instant now = clock.instant();
        return loadAttempts(SubjectType.USER, identifier, now.minus(properties.getAttemptWindow()))
                .map(attempts -> deriveUserLockout(identifier, attempts, now))
                .onErrorResume(e -> failOpen("user_lockout", identifier,
                        e, LockoutStatus.notLocked(identifier, SubjectType.USER, 0, properties.getMaxAttempts())));
    }

    public Mono<LockoutStatus> isIPBlocked(String ip) {
        Instant now = clock.instant();
        return loadAttempts(SubjectType.IP, ip, now.minus(properties.getIpWindow()))
                .map(attempts -> deriveIpBlock(ip, attempts, now))
                .onErrorResume(e -> failOpen("ip_block", ip,
                        e, LockoutStatus.notLocked(ip, SubjectType.IP, 0, properties.getIpMaxAttempts())));
    }

    public Mono<SuspicionScore> checkSuspiciousPatterns(String identifier, String ip, String userAgent) {
        return checkSuspiciousPatterns(identifier, ip, userAgent, null);
    }

    public Mono<SuspicionScore> checkSuspiciousPatterns(
            String identifier, String ip, String userAgent, String deviceFingerprint) {
        Instant now = clock.instant();
        return Mono.zip(
                        loadAttempts(SubjectType.USER, identifier, now.minus(userLookback())),
                        loadAttempts(SubjectType.IP, ip, now.minus(properties.getIpWindow())))
                .map(tuple -> patternDetector.score(
                        identifier, ip, userAgent, deviceFingerprint, tuple.getT1(), tuple.getT2(), now))
                .onErrorResume(e -> failOpen("suspicious_patterns", identifier, e, SuspicionScore.clean()));
    }

    public Mono<Boolean> isCaptchaRequired(String identifier, String ip) {
        if (!properties.isCaptchaEnabled()) {
            return Mono.just(false);
        }
        Instant now = clock.instant();
        return loadAttempts(SubjectType.USER, identifier, now.minus(properties.getAttemptWindow()))
                .map(attempts -> captchaRequired(countFailures(attempts, now, properties.getAttemptWindow())))
                .onErrorResume(e -> failOpen("captcha_required", identifier, e, false));
    }

    public Mono<Duration> calculateProgressiveDelay(String identifier, String ip) {
        if (!properties.isDelayEnabled()) {
            return Mono.just(Duration.ZERO);
        }
        Instant now = clock.instant();
        return loadAttempts(SubjectType.USER, identifier, now.minus(properties.getAttemptWindow()))
                .map(attempts -> progressiveDelay(countFailures(attempts, now, properties.getAttemptWindow())))
                .onErrorResume(e -> failOpen("progressive_delay", identifier, e, Duration.ZERO));
    }

    /* =========================
       Combined Evaluation
       ========================= */

    /**
     * Runs every check against one read of each ledger. The reads are shared,
     * the fail-open fallbacks are not.
     */
    public Mono<LockoutEvaluation> evaluate(String identifier, String ip, String userAgent, String deviceFingerprint) {
        Instant now = clock.instant();

        Mono<List<LoginAttempt>> userAttempts =
                loadAttempts(SubjectType.USER, identifier, now.minus(userLookback())).cache();
        Mono<List<LoginAttempt>> ipAttempts =
                loadAttempts(SubjectType.IP, ip, now.minus(properties.getIpWindow())).cache();

        Mono<LockoutStatus> userLockout = userAttempts
                .map(attempts -> deriveUserLockout(identifier, attempts, now))
                .onErrorResume(e -> failOpen("user_lockout", identifier,
                        e, LockoutStatus.notLocked(identifier, SubjectType.USER, 0, properties.getMaxAttempts())));

        Mono<LockoutStatus> ipBlock = ipAttempts
                .map(attempts -> deriveIpBlock(ip, attempts, now))
                .onErrorResume(e -> failOpen("ip_block", ip,
                        e, LockoutStatus.notLocked(ip, SubjectType.IP, 0, properties.getIpMaxAttempts())));

        Mono<SuspicionScore> suspicion = Mono.zip(userAttempts, ipAttempts)
                .map(tuple -> patternDetector.score(
                        identifier, ip, userAgent, deviceFingerprint, tuple.getT1(), tuple.getT2(), now))
                .onErrorResume(e -> failOpen("suspicious_patterns", identifier, e, SuspicionScore.clean()));

        Mono<Boolean> captcha = properties.isCaptchaEnabled()
                ? userAttempts
                        .map(attempts -> captchaRequired(countFailures(attempts, now, properties.getAttemptWindow())))
                        .onErrorResume(e -> failOpen("captcha_required", identifier, e, false))
                : Mono.just(false);

        Mono<Duration> delay = properties.isDelayEnabled()
                ? userAttempts
                        .map(attempts -> progressiveDelay(countFailures(attempts, now, properties.getAttemptWindow())))
                        .onErrorResume(e -> failOpen("progressive_delay", identifier, e, Duration.ZERO))
                : Mono.just(Duration.ZERO);

        return Mono.zip(userLockout, ipBlock, suspicion, captcha, delay)
                .map(tuple -> LockoutEvaluation.builder()
                        .userLockout(tuple.getT1())
                        .ipBlock(tuple.getT2())
                        .suspicion(tuple.getT3())
                        .captchaRequired(tuple.getT4())
                        .progressiveDelay(tuple.getT5())
                        .attempts(new AttemptCounts(tuple.getT1().getAttempts(), tuple.getT2().getAttempts()))
                        .build());
    }

    /* =========================
       Statistics
       ========================= */

    public Mono<LoginAttemptStats> getLoginAttemptStats(String identifier, String ip) {
        Instant now = clock.instant();
        Instant windowStart = now.minus(properties.getAttemptWindow());

        return Mono.zip(
                        loadAttempts(SubjectType.USER, identifier, windowStart),
                        loadAttempts(SubjectType.IP, ip, now.minus(properties.getIpWindow())))
                .map(tuple -> {
                    List<LoginAttempt> userAttempts = tuple.getT1();
                    LockoutStatus userLockout = deriveUserLockout(identifier, userAttempts, now);
                    LockoutStatus ipBlock = deriveIpBlock(ip, tuple.getT2(), now);
                    Instant lastAttemptAt = userAttempts.stream()
                            .map(LoginAttempt::getTimestamp)
                            .max(Comparator.naturalOrder())
                            .orElse(null);

                    return LoginAttemptStats.builder()
                            .identifier(identifier)
                            .ip(ip)
                            .userAttempts(userLockout.getAttempts())
                            .ipAttempts(ipBlock.getAttempts())
                            .maxAttempts(properties.getMaxAttempts())
                            .ipMaxAttempts(properties.getIpMaxAttempts())
                            .remainingAttempts(Math.max(0, properties.getMaxAttempts() - userLockout.getAttempts()))
                            .windowStart(windowStart)
                            .lastAttemptAt(lastAttemptAt)
                            .userLocked(userLockout.isLocked())
                            .ipBlocked(ipBlock.isLocked())
                            .captchaRequired(properties.isCaptchaEnabled() && captchaRequired(userLockout.getAttempts()))
                            .build();
                });
    }

    /* =========================
       Decision Functions
       ========================= */

    LockoutStatus deriveUserLockout(String identifier, List<LoginAttempt> attempts, Instant now) {
        return deriveLockout(identifier, SubjectType.USER, attempts,
                properties.getMaxAttempts(), properties.getAttemptWindow(), now);
    }

    LockoutStatus deriveIpBlock(String ip, List<LoginAttempt> attempts, Instant now) {
        return deriveLockout(ip, SubjectType.IP, attempts,
                properties.getIpMaxAttempts(), properties.getIpWindow(), now);
    }

    /**
     * Locked while the window holds at least {@code threshold} failures. The
     * lock began with the threshold-th failure and ends when the oldest failure
     * that keeps the count at the threshold leaves the window.
     */
    static LockoutStatus deriveLockout(
            String subject,
            SubjectType subjectType,
            List<LoginAttempt> attempts,
            int threshold,
            Duration window,
            Instant now
    ) {
        Instant windowStart = now.minus(window);
        List<Instant> failures = attempts.stream()
                .filter(attempt -> attempt.getOutcome() != null && attempt.getOutcome().isFailure())
                .map(LoginAttempt::getTimestamp)
                .filter(timestamp -> timestamp.isAfter(windowStart))
                .sorted()
                .toList();

        int count = failures.size();
        if (count < threshold) {
            return LockoutStatus.notLocked(subject, subjectType, count, threshold);
        }

        return LockoutStatus.builder()
                .subject(subject)
                .subjectType(subjectType)
                .locked(true)
                .reason(LockoutReason.TOO_MANY_ATTEMPTS)
                .lockedAt(failures.get(threshold - 1))
                .expiresAt(failures.get(count - threshold).plus(window))
                .attempts(count)
                .threshold(threshold)
                .build();
    }

    boolean captchaRequired(long failures) {
        return failures >= properties.getCaptchaThreshold();
    }

    /**
     * min(maxDelay, baseDelay * 2^(failures - 1)); zero without failures.
     */
    Duration progressiveDelay(long failures) {
        if (failures <= 0) {
            return Duration.ZERO;
        }
        long baseMillis = properties.getBaseDelay().toMillis();
        long maxMillis = properties.getMaxDelay().toMillis();
        int exponent = (int) Math.min(failures - 1, MAX_DELAY_EXPONENT);

        if (baseMillis > (maxMillis >> exponent)) {
            return Duration.ofMillis(maxMillis);
        }
        return Duration.ofMillis(Math.min(maxMillis, baseMillis << exponent));
    }

    /* =========================
       Helpers
       ========================= */

    private Mono<List<LoginAttempt>> loadAttempts(SubjectType subjectType, String subject, Instant windowStart) {
        return attemptLedger.recentAttempts(subjectType, subject, windowStart).collectList();
    }

    private long countFailures(List<LoginAttempt> attempts, Instant now, Duration window) {
        Instant windowStart = now.minus(window);
        return attempts.stream()
                .filter(attempt -> attempt.getOutcome() != null && attempt.getOutcome().isFailure())
                .filter(attempt -> attempt.getTimestamp().isAfter(windowStart))
                .count();
    }

    private Duration userLookback() {
        Duration window = properties.getAttemptWindow();
        Duration velocity = properties.getVelocityWindow();
        return window.compareTo(velocity) >= 0 ? window : velocity;
    }

    private <T> Mono<T> failOpen(String check, String subject, Throwable error, T fallback) {
        log.error("Security check {} failed for {}, failing open: {}",
                check, mask(subject), error.getMessage());
        auditLogService.logFailOpen(check, mask(subject), error);
        return Mono.just(fallback);
    }

    private static String mask(String subject) {
        return HelperUtils.isEmail(subject) ? HelperUtils.maskIdentifier(subject) : HelperUtils.maskIpAddress(subject);
    }
}
