package com.techStack.sessionGuard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "security.user-directory")
public class UserDirectoryProperties {
    private String baseUrl = "http://localhost:5000";
    private String lookupPath = "/internal/users/lookup";
    private String byIdPath = "/internal/users/{id}";
    private String serviceToken;
    private Duration timeout = Duration.ofSeconds(3);
}
