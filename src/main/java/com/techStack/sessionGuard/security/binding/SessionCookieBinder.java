package com.techStack.sessionGuard.security.binding;

import com.techStack.sessionGuard.config.SessionProperties;
import com.techStack.sessionGuard.models.security.SecurityContext;
import com.techStack.sessionGuard.models.session.Session;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static com.techStack.sessionGuard.constants.SecurityConstants.*;

/**
 * Session Cookie Binder
 *
 * Moves session state between the HTTP exchange and the session layer:
 * sets and clears the {@code sessionId}, {@code rememberMe} and
 * {@code rememberMeEnabled} cookies, writes the X-Session-* and login
 * security headers, and resolves credentials from incoming requests.
 */
@Component
@RequiredArgsConstructor
public class SessionCookieBinder {

    private static final String SAME_SITE = "Strict";
    private static final String COOKIE_PATH = "/";

    private final SessionProperties properties;
    private final Clock clock;

    /* =========================
       Outbound: Cookies
       ========================= */

    /**
     * Sets the session cookie and the session headers. Without a remember-me
     * token any previous remember-me cookies are cleared.
     */
    public void bindSession(ServerHttpResponse response, Session session, String rememberMeToken) {
        bindSessionCookie(response, session);

        if (StringUtils.hasText(rememberMeToken)) {
            Duration tokenTtl = properties.getRememberMeTokenTtl();
            response.addCookie(cookie(REMEMBER_ME_COOKIE, rememberMeToken, tokenTtl, true));
            response.addCookie(cookie(REMEMBER_ME_ENABLED_COOKIE, "true", tokenTtl, false));
        } else {
            clearRememberMeCookies(response);
        }
    }

    /**
     * Re-issues the session cookie only, leaving remember-me cookies untouched.
     */
    public void bindSessionCookie(ServerHttpResponse response, Session session) {
        Duration maxAge = session.remainingTtl(clock.instant());
        response.addCookie(cookie(SESSION_COOKIE, session.getSessionId(), maxAge, true));
        writeSessionHeaders(response.getHeaders(), session);
    }

    public void clearSessionCookies(ServerHttpResponse response) {
        response.addCookie(cookie(SESSION_COOKIE, "", Duration.ZERO, true));
        clearRememberMeCookies(response);
    }

    private void clearRememberMeCookies(ServerHttpResponse response) {
        response.addCookie(cookie(REMEMBER_ME_COOKIE, "", Duration.ZERO, true));
        response.addCookie(cookie(REMEMBER_ME_ENABLED_COOKIE, "", Duration.ZERO, false));
    }

    private ResponseCookie cookie(String name, String value, Duration maxAge, boolean httpOnly) {
        ResponseCookie.ResponseCookieBuilder builder = ResponseCookie.from(name, value)
                .httpOnly(httpOnly)
                .secure(properties.isSecureCookies())
                .sameSite(SAME_SITE)
                .path(COOKIE_PATH)
                .maxAge(maxAge);
        if (StringUtils.hasText(properties.getCookieDomain())) {
            builder.domain(properties.getCookieDomain());
        }
        return builder.build();
    }

    /* =========================
       Outbound: Headers
       ========================= */

    public void writeSessionHeaders(HttpHeaders headers, Session session) {
        headers.set(HEADER_SESSION_ID, session.getSessionId());
        headers.set(HEADER_SESSION_EXPIRES_AT, session.getExpiresAt().toString());
        headers.set(HEADER_SESSION_MAX_AGE, String.valueOf(session.getMaxAgeMillis()));
        headers.set(HEADER_SESSION_SECURITY_LEVEL, session.getSecurityLevel() != null
                ? session.getSecurityLevel().getValue()
                : "standard");
    }

    /**
     * Login security headers, emitted on passthrough and on denials.
     */
    public void writeSecurityHeaders(HttpHeaders headers, SecurityContext context) {
        Instant timestamp = context.getEvaluatedAt() != null ? context.getEvaluatedAt() : clock.instant();

        headers.set(HEADER_LOGIN_SECURITY_ENABLED, String.valueOf(context.isEnabled()));
        headers.set(HEADER_SECURITY_TIMESTAMP, timestamp.toString());
        if (!context.isEnabled()) {
            return;
        }
        headers.set(HEADER_USER_LOCKED, String.valueOf(context.isUserLocked()));
        headers.set(HEADER_IP_BLOCKED, String.valueOf(context.isIpBlocked()));
        headers.set(HEADER_CAPTCHA_REQUIRED, String.valueOf(context.isCaptchaRequired()));
        headers.set(HEADER_SUSPICIOUS_ACTIVITY, String.valueOf(context.isSuspicious()));
        headers.set(HEADER_PROGRESSIVE_DELAY, String.valueOf(context.getProgressiveDelayMillis()));
    }

    /* =========================
       Inbound
       ========================= */

    /**
     * Bearer token, then X-Session-ID, then the sessionId cookie, then the
     * session_id query parameter. Null when none is present.
     */
    public String resolveSessionId(ServerHttpRequest request) {
        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }

        String header = request.getHeaders().getFirst(HEADER_SESSION_ID);
        if (StringUtils.hasText(header)) {
            return header.trim();
        }

        String cookie = cookieValue(request, SESSION_COOKIE);
        if (cookie != null) {
            return cookie;
        }

        String query = request.getQueryParams().getFirst(SESSION_QUERY_PARAM);
        return StringUtils.hasText(query) ? query.trim() : null;
    }

    public String resolveRememberMeToken(ServerHttpRequest request) {
        return cookieValue(request, REMEMBER_ME_COOKIE);
    }

    private String cookieValue(ServerHttpRequest request, String name) {
        HttpCookie cookie = request.getCookies().getFirst(name);
        return cookie != null && StringUtils.hasText(cookie.getValue()) ? cookie.getValue() : null;
    }
}
