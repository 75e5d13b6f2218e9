package com.techStack.sessionGuard.models.session;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class SessionStats {
    long activeSessions;
    long rememberMeSessions;
    Map<String, Long> byLoginType;
    Map<String, Long> bySecurityLevel;
    Instant generatedAt;
}
