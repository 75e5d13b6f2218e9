package com.techStack.sessionGuard.service.security;

import com.techStack.sessionGuard.config.LoginSecurityProperties;
import com.techStack.sessionGuard.models.attempt.LoginAttempt;
import com.techStack.sessionGuard.models.security.SuspicionScore;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.techStack.sessionGuard.constants.SecurityConstants.*;

/**
 * Suspicious Pattern Detector
 *
 * Scores a login attempt against recent ledger history. Pure: the same inputs
 * always give the same score. The score escalates to CAPTCHA and logging, it
 * never blocks on its own.
 */
@Component
@RequiredArgsConstructor
public class SuspiciousPatternDetector {

    static final String HIGH_ATTEMPT_VOLUME = "high_attempt_volume";
    static final String RAPID_ATTEMPTS = "rapid_attempts";
    static final String DEVICE_CHURN = "device_churn";
    static final String CREDENTIAL_STUFFING = "credential_stuffing";
    static final String MALICIOUS_USER_AGENT = "malicious_user_agent";
    static final String AUTOMATED_TOOL = "automated_tool";
    static final String MISSING_USER_AGENT = "missing_user_agent";
    static final String DISPOSABLE_IDENTIFIER = "disposable_identifier";

    private final LoginSecurityProperties properties;

    public SuspicionScore score(
            String identifier,
            String ip,
            String userAgent,
            String deviceFingerprint,
            List<LoginAttempt> identifierAttempts,
            List<LoginAttempt> ipAttempts,
            Instant now
    ) {
        List<String> reasons = new ArrayList<>();
        int riskScore = 0;

        Instant windowStart = now.minus(properties.getAttemptWindow());
        Instant velocityStart = now.minus(properties.getVelocityWindow());

        long ipFailures = ipAttempts.stream()
                .filter(attempt -> attempt.getTimestamp().isAfter(windowStart))
                .filter(attempt -> attempt.getOutcome().isFailure())
                .count();
        if (ipFailures > properties.getHighVolumeThreshold()) {
            reasons.add(HIGH_ATTEMPT_VOLUME);
            riskScore += 3;
        }

        long identifierVelocity = countSince(identifierAttempts, velocityStart);
        long ipVelocity = countSince(ipAttempts, velocityStart);
        if (Math.max(identifierVelocity, ipVelocity) > properties.getVelocityThreshold()) {
            reasons.add(RAPID_ATTEMPTS);
            riskScore += 2;
        }

        List<LoginAttempt> windowedIdentifierAttempts = identifierAttempts.stream()
                .filter(attempt -> attempt.getTimestamp().isAfter(windowStart))
                .toList();
        int agentChurn = distinct(windowedIdentifierAttempts, LoginAttempt::getUserAgent, userAgent);
        int fingerprintChurn = distinct(windowedIdentifierAttempts, LoginAttempt::getDeviceFingerprint, deviceFingerprint);
        if (Math.max(agentChurn, fingerprintChurn) >= properties.getDeviceChurnThreshold()) {
            reasons.add(DEVICE_CHURN);
            riskScore += 2;
        }

        List<LoginAttempt> windowedIpAttempts = ipAttempts.stream()
                .filter(attempt -> attempt.getTimestamp().isAfter(windowStart))
                .toList();
        if (distinct(windowedIpAttempts, LoginAttempt::getIdentifier, identifier) >= properties.getIdentifierSprayThreshold()) {
            reasons.add(CREDENTIAL_STUFFING);
            riskScore += 3;
        }

        if (!StringUtils.hasText(userAgent) || UNKNOWN_USER_AGENT.equals(userAgent)) {
            reasons.add(MISSING_USER_AGENT);
            riskScore += 1;
        } else if (MALICIOUS_USER_AGENT_PATTERN.matcher(userAgent).find()) {
            reasons.add(MALICIOUS_USER_AGENT);
            riskScore += 5;
        } else if (riskScore > 0 && AUTOMATED_TOOL_PATTERN.matcher(userAgent).find()) {
            reasons.add(AUTOMATED_TOOL);
            riskScore += 2;
        }

        String domain = HelperUtils.emailDomain(identifier);
        if (domain != null && DISPOSABLE_EMAIL_DOMAINS.contains(domain)) {
            reasons.add(DISPOSABLE_IDENTIFIER);
            riskScore += 1;
        }

        return SuspicionScore.of(reasons, riskScore);
    }

    private long countSince(List<LoginAttempt> attempts, Instant since) {
        return attempts.stream()
                .filter(attempt -> attempt.getTimestamp().isAfter(since))
                .count();
    }

    private int distinct(List<LoginAttempt> attempts, Function<LoginAttempt, String> field, String current) {
        Set<String> values = Stream.concat(attempts.stream().map(field), Stream.of(current))
                .filter(Objects::nonNull)
                .filter(StringUtils::hasText)
                .collect(Collectors.toSet());
        return values.size();
    }
}
