package com.techStack.sessionGuard.security.config;

import com.techStack.sessionGuard.exception.session.InvalidSessionException;
import com.techStack.sessionGuard.handler.ErrorResponseFactory;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import static com.techStack.sessionGuard.constants.SecurityConstants.ATTR_SESSION_INVALID_REASON;

/**
 * Session Authentication Entry Point
 *
 * Answers 401 with SESSION_REQUIRED when no session id was sent and
 * SESSION_INVALID with the reason otherwise.
 */
@Component
@RequiredArgsConstructor
public class SessionAuthenticationEntryPoint implements ServerAuthenticationEntryPoint {

    private static final Logger logger = LoggerFactory.getLogger(SessionAuthenticationEntryPoint.class);
    private static final String REALM = "session-guard";

    private final ErrorResponseFactory errorResponseFactory;

    @Override
    public Mono<Void> commence(ServerWebExchange exchange, AuthenticationException ex) {
        SessionInvalidReason reason = exchange.getAttributeOrDefault(
                ATTR_SESSION_INVALID_REASON, SessionInvalidReason.MISSING);

        logger.debug("Unauthenticated {} {}: {}",
                exchange.getRequest().getMethod(), exchange.getRequest().getPath(), reason.getValue());

        HttpHeaders headers = exchange.getResponse().getHeaders();
        headers.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"" + REALM + "\"");
        headers.set(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate");

        return errorResponseFactory.write(exchange, new InvalidSessionException(reason));
    }
}
