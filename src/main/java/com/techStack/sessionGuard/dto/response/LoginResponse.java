package com.techStack.sessionGuard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {
    String userId;
    SessionResponse session;
    boolean rememberMe;
    SecurityInfo security;

    @Value
    @Builder
    public static class SecurityInfo {
        boolean enabled;
        boolean captchaRequired;
        boolean suspiciousActivity;
        long progressiveDelay;
    }
}
