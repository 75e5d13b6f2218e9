package com.techStack.sessionGuard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "security.captcha")
public class CaptchaProperties {
    private String verifyUrl;
    private String secret;
    private Duration timeout = Duration.ofSeconds(3);

    /** Treat a provider outage as a passed challenge. Off by default. */
    private boolean failOpen = false;
}
