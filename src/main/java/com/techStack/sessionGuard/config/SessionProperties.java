package com.techStack.sessionGuard.config;

import com.techStack.sessionGuard.models.session.FingerprintPolicy;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "security.session")
public class SessionProperties {

    @NotNull
    private Duration defaultMaxAge = Duration.ofHours(24);

    @NotNull
    private Duration rememberMeMaxAge = Duration.ofDays(7);

    @NotNull
    private Duration rememberMeTokenTtl = Duration.ofDays(30);

    @NotNull
    private Duration minMaxAge = Duration.ofMinutes(5);

    @NotNull
    private Duration maxMaxAge = Duration.ofDays(30);

    @NotNull
    private Duration freshnessWindow = Duration.ofMinutes(30);

    /** How long an expired record stays readable so it can be reported as expired. */
    @NotNull
    private Duration expiredRetention = Duration.ofHours(1);

    /**
     * Shared secret a back-end caller presents in {@code X-Service-Token} to create
     * sessions directly. Blank closes that route.
     */
    private String trustedCallerToken;

    private boolean trackActivity = true;

    @NotNull
    private FingerprintPolicy fingerprintPolicy = FingerprintPolicy.LOG;

    /** Secure flag on cookies; on in production. */
    private boolean secureCookies = true;

    private String cookieDomain;
}
