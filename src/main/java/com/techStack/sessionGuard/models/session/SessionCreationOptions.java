package com.techStack.sessionGuard.models.session;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Options for a new session. Null fields fall back to configured defaults.
 */
@Value
@Builder
public class SessionCreationOptions {

    @Builder.Default
    LoginType loginType = LoginType.PASSWORD;
    boolean rememberMe;
    Duration maxAge;
    SecurityLevel securityLevel;
    String rememberMeLineage;

    public static SessionCreationOptions defaults() {
        return SessionCreationOptions.builder().build();
    }
}
