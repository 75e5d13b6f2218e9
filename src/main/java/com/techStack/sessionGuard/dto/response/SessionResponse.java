package com.techStack.sessionGuard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Client view of a session. The IP is masked; the id is only included for
 * the caller's own current session.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionResponse {
    String sessionId;
    String userId;
    String loginType;
    String securityLevel;
    boolean rememberMe;
    boolean current;
    String ipAddress;
    String userAgent;
    Instant createdAt;
    Instant lastActivity;
    Instant expiresAt;
    long maxAge;

    public static SessionResponse of(Session session, boolean current, boolean includeId) {
        return SessionResponse.builder()
                .sessionId(includeId ? session.getSessionId() : null)
                .userId(session.getUserId())
                .loginType(session.getLoginType() != null ? session.getLoginType().getValue() : null)
                .securityLevel(session.getSecurityLevel() != null ? session.getSecurityLevel().getValue() : null)
                .rememberMe(session.isRememberMe())
                .current(current)
                .ipAddress(HelperUtils.maskIpAddress(session.getIpAddress()))
                .userAgent(session.getUserAgent())
                .createdAt(session.getCreatedAt())
                .lastActivity(session.getLastActivity())
                .expiresAt(session.getExpiresAt())
                .maxAge(session.getMaxAgeMillis())
                .build();
    }
}
