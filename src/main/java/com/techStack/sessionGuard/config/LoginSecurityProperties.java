package com.techStack.sessionGuard.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Login security policy: lockout and IP-block thresholds, CAPTCHA escalation,
 * progressive delay and suspicion heuristics.
 *
 * The escalation ladder must put CAPTCHA at or below the lockout threshold;
 * anything else is rejected when the context starts.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "security.login")
public class LoginSecurityProperties {

    /** Escape hatch for test environments, bound to DISABLE_LOGIN_SECURITY. */
    private boolean disabled = false;

    @Min(1)
    private int maxAttempts = 5;

    @NotNull
    private Duration attemptWindow = Duration.ofMinutes(15);

    @Min(1)
    private int ipMaxAttempts = 20;

    @NotNull
    private Duration ipWindow = Duration.ofHours(1);

    /** How long ledger entries are kept at all. */
    @NotNull
    private Duration retention = Duration.ofHours(1);

    private boolean delayEnabled = true;

    @NotNull
    private Duration baseDelay = Duration.ofMillis(1000);

    @NotNull
    private Duration maxDelay = Duration.ofMillis(10000);

    private boolean captchaEnabled = true;

    @Min(1)
    private int captchaThreshold = 3;

    /** Risk score from which suspicion alone requires a CAPTCHA. */
    @Min(1)
    private int captchaEscalationScore = 5;

    /** Reject passthrough requests with a high risk score or several violations (403). */
    private boolean strictValidation = false;

    @Min(1)
    private int strictRiskScore = 5;

    @NotNull
    private Duration velocityWindow = Duration.ofMinutes(1);

    @Min(1)
    private int velocityThreshold = 5;

    @Min(1)
    private int highVolumeThreshold = 10;

    @Min(2)
    private int deviceChurnThreshold = 3;

    @Min(2)
    private int identifierSprayThreshold = 5;

    @AssertTrue(message = "captcha-threshold must not exceed max-attempts")
    public boolean isEscalationLadderValid() {
        return captchaThreshold <= maxAttempts;
    }

    @AssertTrue(message = "retention must cover both attempt-window and ip-window")
    public boolean isRetentionValid() {
        return retention == null || attemptWindow == null || ipWindow == null
                || (retention.compareTo(attemptWindow) >= 0 && retention.compareTo(ipWindow) >= 0);
    }

    @AssertTrue(message = "max-delay must not be below base-delay")
    public boolean isDelayRangeValid() {
        return baseDelay == null || maxDelay == null || maxDelay.compareTo(baseDelay) >= 0;
    }
}
