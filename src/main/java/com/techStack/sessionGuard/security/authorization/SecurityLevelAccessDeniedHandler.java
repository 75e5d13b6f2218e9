package com.techStack.sessionGuard.security.authorization;

import com.techStack.sessionGuard.exception.session.InsufficientSecurityLevelException;
import com.techStack.sessionGuard.handler.ErrorResponseFactory;
import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.models.session.Session;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.web.server.authorization.ServerAccessDeniedHandler;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Authenticated callers reach this handler by failing a level rule or by
 * using a route reserved for the other kind of caller. Level rules in the
 * chain ask for {@code high}; a non-session principal reports as {@code low}.
 */
@Component
@RequiredArgsConstructor
public class SecurityLevelAccessDeniedHandler implements ServerAccessDeniedHandler {

    private static final Logger logger = LoggerFactory.getLogger(SecurityLevelAccessDeniedHandler.class);

    private final ErrorResponseFactory errorResponseFactory;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, AccessDeniedException ex) {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .map(Authentication::getPrincipal)
                .filter(Session.class::isInstance)
                .map(principal -> ((Session) principal).getSecurityLevel())
                .defaultIfEmpty(SecurityLevel.LOW)
                .flatMap(current -> {
                    logger.warn("Access denied on {} {} for security level {}",
                            exchange.getRequest().getMethod(), exchange.getRequest().getPath(), current.getValue());
                    return errorResponseFactory.write(exchange,
                            new InsufficientSecurityLevelException(SecurityLevel.HIGH, current));
                });
    }
}
