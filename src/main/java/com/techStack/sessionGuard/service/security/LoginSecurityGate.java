package com.techStack.sessionGuard.service.security;

import com.techStack.sessionGuard.config.CaptchaProperties;
import com.techStack.sessionGuard.config.LoginSecurityProperties;
import com.techStack.sessionGuard.dto.internal.LoginGateRequest;
import com.techStack.sessionGuard.dto.internal.RequestContext;
import com.techStack.sessionGuard.event.AccountLockedEvent;
import com.techStack.sessionGuard.event.IpBlockedEvent;
import com.techStack.sessionGuard.exception.security.AccountLockedException;
import com.techStack.sessionGuard.exception.security.CaptchaRequiredException;
import com.techStack.sessionGuard.exception.security.IpBlockedException;
import com.techStack.sessionGuard.exception.security.LoginSecurityException;
import com.techStack.sessionGuard.exception.security.SecurityValidationException;
import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.attempt.AttemptOutcome;
import com.techStack.sessionGuard.models.attempt.LoginAttempt;
import com.techStack.sessionGuard.models.security.GateState;
import com.techStack.sessionGuard.models.security.LockoutEvaluation;
import com.techStack.sessionGuard.models.security.LockoutStatus;
import com.techStack.sessionGuard.models.security.SecurityContext;
import com.techStack.sessionGuard.repository.attempt.AttemptLedger;
import com.techStack.sessionGuard.repository.security.CaptchaVerifier;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.techStack.sessionGuard.constants.SecurityConstants.UNKNOWN_IDENTIFIER;
import static com.techStack.sessionGuard.constants.SecurityConstants.UNKNOWN_IP;

/**
 * Login Security Gate
 *
 * Runs before credential verification:
 * START → LOCKOUT_CHECK → IP_CHECK → SUSPICION_CHECK → CAPTCHA_CHECK → DELAY → PASSTHROUGH.
 * Lockout and IP checks end the pass with 423, a missing or rejected CAPTCHA
 * with 429. After verification the caller reports the outcome through
 * {@link #recordOutcome}: success clears history, failure appends to it.
 *
 * Uses Clock for all timestamps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginSecurityGate {

    private static final String DECISION_COUNTER = "login.gate.decisions";

    /* =========================
       Dependencies
       ========================= */

    private final LockoutEvaluator lockoutEvaluator;
    private final AttemptLedger attemptLedger;
    private final CaptchaVerifier captchaVerifier;
    private final LoginSecurityProperties properties;
    private final CaptchaProperties captchaProperties;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Scheduler loginDelayScheduler;
    private final Clock clock;

    /* =========================
       Enforcement
       ========================= */

    /**
     * Evaluates the attempt and either completes with the security context
     * (after the progressive delay) or errors with the denial.
     */
    public Mono<SecurityContext> enforce(LoginGateRequest request) {
        RequestContext requestContext = request.getRequestContext();
        String identifier = resolveIdentifier(request.getIdentifier());
        String ip = requestContext != null && StringUtils.hasText(requestContext.getIp())
                ? requestContext.getIp()
                : UNKNOWN_IP;
        String userAgent = requestContext != null ? requestContext.getUserAgent() : null;
        String fingerprint = requestContext != null ? requestContext.getDeviceFingerprint() : null;

        if (properties.isDisabled()) {
            log.debug("Login security disabled, passing {} through", HelperUtils.maskIdentifier(identifier));
            countDecision(GateState.PASSTHROUGH, "disabled");
            return Mono.just(SecurityContext.disabled(identifier, ip, clock.instant()));
        }

        Instant start = clock.instant();

        return lockoutEvaluator.evaluate(identifier, ip, userAgent, fingerprint)
                .map(evaluation -> buildContext(identifier, ip, userAgent, fingerprint, evaluation))
                .flatMap(context -> advance(GateState.START, context, request.getCaptchaToken()))
                .doOnSuccess(context -> log.debug("Login gate passed for {} in {}",
                        HelperUtils.maskIdentifier(identifier), Duration.between(start, clock.instant())))
                .onErrorMap(e -> !(e instanceof CustomException), e -> {
                    log.error("Login security pipeline failed for {}: {}",
                            HelperUtils.maskIdentifier(identifier), e.getMessage(), e);
                    countDecision(GateState.START, "error");
                    return new LoginSecurityException("Login security check failed", e);
                });
    }

    private Mono<SecurityContext> advance(GateState state, SecurityContext context, String captchaToken) {
        return Mono.defer(() -> switch (state) {
            case START -> advance(GateState.LOCKOUT_CHECK, context, captchaToken);

            case LOCKOUT_CHECK -> context.isUserLocked()
                    ? deny(state, context, new AccountLockedException(context.getUserLockout(), context))
                    : advance(GateState.IP_CHECK, context, captchaToken);

            case IP_CHECK -> context.isIpBlocked()
                    ? deny(state, context, new IpBlockedException(context.getIpBlock(), context))
                    : advance(GateState.SUSPICION_CHECK, context, captchaToken);

            case SUSPICION_CHECK -> {
                if (context.isSuspicious()) {
                    logSuspicion(context);
                }
                yield advance(GateState.CAPTCHA_CHECK, context, captchaToken);
            }

            case CAPTCHA_CHECK -> context.isCaptchaRequired()
                    ? verifyCaptcha(captchaToken, context).flatMap(passed -> passed
                            ? advance(GateState.DELAY, context, captchaToken)
                            : deny(state, context, new CaptchaRequiredException(context, StringUtils.hasText(captchaToken))))
                    : advance(GateState.DELAY, context, captchaToken);

            case DELAY -> {
                Duration delay = cap(context.getProgressiveDelay());
                yield delay.isZero()
                        ? advance(GateState.PASSTHROUGH, context, captchaToken)
                        : Mono.delay(delay, loginDelayScheduler)
                                .then(advance(GateState.PASSTHROUGH, context, captchaToken));
            }

            case PASSTHROUGH -> {
                countDecision(state, "passed");
                yield Mono.just(context);
            }
        });
    }

    /**
     * Rejects the request. Locked-out attempts are appended as {@code locked}
     * so the velocity heuristics keep seeing hammering.
     */
    private Mono<SecurityContext> deny(GateState state, SecurityContext context, CustomException denial) {
        countDecision(state, denial.getCode());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ip", HelperUtils.maskIpAddress(context.getIp()));
        details.put("state", state.name());
        details.put("userAttempts", context.getAttempts().getIdentifierFailures());
        details.put("ipAttempts", context.getAttempts().getIpFailures());
        auditLogService.logSecurityEvent(denial.getCode(), HelperUtils.maskIdentifier(context.getIdentifier()), details);

        Mono<Void> recordLocked = state == GateState.CAPTCHA_CHECK
                ? Mono.empty()
                : attemptLedger.record(attempt(context.getIdentifier(), context.getIp(),
                                context.getUserAgent(), context.getDeviceFingerprint(), AttemptOutcome.LOCKED))
                        .onErrorResume(e -> {
                            auditLogService.logFailOpen("record_locked_attempt", context.getIp(), e);
                            return Mono.empty();
                        });

        return recordLocked.then(Mono.error(denial));
    }

    /* =========================
       CAPTCHA
       ========================= */

    private Mono<Boolean> verifyCaptcha(String token, SecurityContext context) {
        if (!StringUtils.hasText(token)) {
            return Mono.just(false);
        }
        return captchaVerifier.verify(token, context.getIp())
                .timeout(captchaProperties.getTimeout())
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("CAPTCHA provider unavailable, treating as {}: {}",
                            captchaProperties.isFailOpen() ? "passed" : "failed", e.getMessage());
                    if (captchaProperties.isFailOpen()) {
                        auditLogService.logFailOpen("captcha_verification", context.getIp(), e);
                    } else {
                        auditLogService.logSystemEvent("CAPTCHA_PROVIDER_UNAVAILABLE", e.getMessage());
                    }
                    return Mono.just(captchaProperties.isFailOpen());
                });
    }

    /* =========================
       Strict Validation
       ========================= */

    /**
     * Optional second line after passthrough: rejects with 403 when the risk
     * score is high or two or more suspicious patterns were seen.
     */
    public Mono<SecurityContext> validateSecurity(SecurityContext context) {
        if (!properties.isStrictValidation() || !context.isEnabled() || context.getSuspicion() == null) {
            return Mono.just(context);
        }

        int riskScore = context.getSuspicion().getRiskScore();
        int violations = context.getSuspicion().getReasons().size();

        if (riskScore >= properties.getStrictRiskScore() || violations >= 2) {
            countDecision(GateState.PASSTHROUGH, "SECURITY_VALIDATION_FAILED");
            auditLogService.logSecurityEvent("SECURITY_VALIDATION_FAILED",
                    HelperUtils.maskIdentifier(context.getIdentifier()),
                    Map.of("riskScore", riskScore, "violations", context.getSuspicion().getReasons()));
            return Mono.error(new SecurityValidationException(
                    context.getSuspicion().getReasons(), riskScore, context));
        }
        return Mono.just(context);
    }

    /* =========================
       Outcome Recording
       ========================= */

    /**
     * Success clears the identifier's history and its entries in the IP
     * ledger. A failure is appended and, when it brings a subject to its
     * threshold, announces the lockout. Store errors are audited and swallowed.
     */
    public Mono<Void> recordOutcome(String identifier, RequestContext requestContext, AttemptOutcome outcome) {
        if (properties.isDisabled()) {
            return Mono.empty();
        }

        String resolvedIdentifier = resolveIdentifier(identifier);
        String ip = requestContext != null && StringUtils.hasText(requestContext.getIp())
                ? requestContext.getIp()
                : UNKNOWN_IP;

        if (outcome == AttemptOutcome.SUCCESS) {
            return attemptLedger.clear(resolvedIdentifier, ip)
                    .doOnSuccess(v -> auditLogService.logSecurityEvent("LOGIN_SUCCESS",
                            HelperUtils.maskIdentifier(resolvedIdentifier),
                            Map.of("ip", HelperUtils.maskIpAddress(ip))))
                    .onErrorResume(e -> {
                        auditLogService.logFailOpen("clear_attempts", HelperUtils.maskIdentifier(resolvedIdentifier), e);
                        return Mono.empty();
                    });
        }

        LoginAttempt attempt = attempt(resolvedIdentifier, ip,
                requestContext != null ? requestContext.getUserAgent() : null,
                requestContext != null ? requestContext.getDeviceFingerprint() : null,
                outcome);

        return attemptLedger.record(attempt)
                .then(announceThresholds(resolvedIdentifier, ip))
                .doOnSuccess(v -> auditLogService.logSecurityEvent("LOGIN_FAILURE",
                        HelperUtils.maskIdentifier(resolvedIdentifier),
                        Map.of("ip", HelperUtils.maskIpAddress(ip), "reason", outcome.getValue())))
                .onErrorResume(e -> {
                    auditLogService.logFailOpen("record_attempt", HelperUtils.maskIdentifier(resolvedIdentifier), e);
                    return Mono.empty();
                });
    }

    private Mono<Void> announceThresholds(String identifier, String ip) {
        Mono<Void> userCheck = lockoutEvaluator.isUserLockedOut(identifier)
                .filter(lockout -> justReachedThreshold(lockout))
                .doOnNext(lockout -> eventPublisher.publishEvent(
                        new AccountLockedEvent(this, identifier, ip, lockout)))
                .then();

        Mono<Void> ipCheck = lockoutEvaluator.isIPBlocked(ip)
                .filter(block -> justReachedThreshold(block))
                .doOnNext(block -> eventPublisher.publishEvent(new IpBlockedEvent(this, ip, block)))
                .then();

        return Mono.when(userCheck, ipCheck);
    }

    private boolean justReachedThreshold(LockoutStatus status) {
        return status.isLocked() && status.getAttempts() == status.getThreshold();
    }

    /* =========================
       Helpers
       ========================= */

    private SecurityContext buildContext(
            String identifier, String ip, String userAgent, String fingerprint, LockoutEvaluation evaluation) {

        boolean escalated = properties.isCaptchaEnabled()
                && evaluation.getSuspicion().getRiskScore() >= properties.getCaptchaEscalationScore();

        return SecurityContext.builder()
                .enabled(true)
                .identifier(identifier)
                .ip(ip)
                .userAgent(userAgent)
                .deviceFingerprint(fingerprint)
                .userLockout(evaluation.getUserLockout())
                .ipBlock(evaluation.getIpBlock())
                .suspicion(evaluation.getSuspicion())
                .captchaRequired(evaluation.isCaptchaRequired() || escalated)
                .progressiveDelay(cap(evaluation.getProgressiveDelay()))
                .attempts(evaluation.getAttempts())
                .evaluatedAt(clock.instant())
                .build();
    }

    private void logSuspicion(SecurityContext context) {
        log.warn("Suspicious login activity for {} from {}: {} (risk {})",
                HelperUtils.maskIdentifier(context.getIdentifier()),
                HelperUtils.maskIpAddress(context.getIp()),
                context.getSuspicion().getReasons(),
                context.getSuspicion().getRiskScore());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ip", HelperUtils.maskIpAddress(context.getIp()));
        details.put("reasons", context.getSuspicion().getReasons());
        details.put("riskScore", context.getSuspicion().getRiskScore());
        auditLogService.logSecurityEvent("SUSPICIOUS_LOGIN_ACTIVITY",
                HelperUtils.maskIdentifier(context.getIdentifier()), details);
    }

    private Duration cap(Duration delay) {
        if (delay == null || delay.isNegative()) {
            return Duration.ZERO;
        }
        return delay.compareTo(properties.getMaxDelay()) > 0 ? properties.getMaxDelay() : delay;
    }

    private LoginAttempt attempt(String identifier, String ip, String userAgent, String fingerprint, AttemptOutcome outcome) {
        return LoginAttempt.builder()
                .identifier(identifier)
                .ip(ip)
                .userAgent(userAgent)
                .deviceFingerprint(fingerprint)
                .outcome(outcome)
                .timestamp(clock.instant())
                .build();
    }

    private String resolveIdentifier(String identifier) {
        return StringUtils.hasText(identifier) ? HelperUtils.normalizeIdentifier(identifier) : UNKNOWN_IDENTIFIER;
    }

    private void countDecision(GateState state, String outcome) {
        meterRegistry.counter(DECISION_COUNTER, "state", state.name(), "outcome", outcome).increment();
    }
}
