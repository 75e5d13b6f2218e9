package com.techStack.sessionGuard.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Bounds every call to the shared store.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "security.store")
public class StoreProperties {
    @NotNull
    private Duration timeout = Duration.ofSeconds(2);
}
