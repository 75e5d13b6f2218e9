package com.techStack.sessionGuard.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * IP-keyed pre-filter for the login route. Independent of account lockout.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "security.rate-limit.login")
public class RateLimitProperties {
    private boolean enabled = true;

    @NotNull
    private Duration window = Duration.ofMinutes(15);

    @Min(1)
    private int maxRequests = 10;

    private String path = "/api/auth/login";
}
