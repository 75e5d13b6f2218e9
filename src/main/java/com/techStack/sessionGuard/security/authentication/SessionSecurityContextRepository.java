package com.techStack.sessionGuard.security.authentication;

import com.techStack.sessionGuard.config.SessionProperties;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import com.techStack.sessionGuard.service.auth.RequestContextResolver;
import com.techStack.sessionGuard.service.session.SessionManager;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextImpl;
import org.springframework.security.web.server.context.ServerSecurityContextRepository;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static com.techStack.sessionGuard.constants.SecurityConstants.ATTR_SESSION_INVALID_REASON;
import static com.techStack.sessionGuard.constants.SecurityConstants.HEADER_SERVICE_TOKEN;

/**
 * Loads the security context from the session id carried by the request.
 * An invalid or missing session leaves the exchange anonymous and records
 * the reason for the entry point. A request carrying the configured
 * service token is loaded as a {@link TrustedCallerAuthenticationToken}.
 */
@Component
@RequiredArgsConstructor
public class SessionSecurityContextRepository implements ServerSecurityContextRepository {

    private static final Logger logger = LoggerFactory.getLogger(SessionSecurityContextRepository.class);

    private final SessionManager sessionManager;
    private final SessionCookieBinder binder;
    private final RequestContextResolver requestContextResolver;
    private final SessionProperties properties;

    @Override
    public Mono<Void> save(ServerWebExchange exchange, SecurityContext context) {
        return Mono.empty(); // sessions are written by SessionManager only
    }

    @Override
    public Mono<SecurityContext> load(ServerWebExchange exchange) {
        String serviceToken = exchange.getRequest().getHeaders().getFirst(HEADER_SERVICE_TOKEN);
        if (serviceToken != null) {
            if (isTrustedCaller(serviceToken)) {
                return Mono.just(new SecurityContextImpl(new TrustedCallerAuthenticationToken()));
            }
            logger.warn("Rejected service token on {}", exchange.getRequest().getPath());
        }

        String sessionId = binder.resolveSessionId(exchange.getRequest());
        if (sessionId == null) {
            exchange.getAttributes().put(ATTR_SESSION_INVALID_REASON, SessionInvalidReason.MISSING);
            return Mono.empty();
        }

        return sessionManager.validateSession(sessionId, requestContextResolver.resolve(exchange))
                .flatMap(result -> {
                    if (!result.isValid()) {
                        exchange.getAttributes().put(ATTR_SESSION_INVALID_REASON, result.getReason());
                        logger.debug("Session rejected on {}: {}",
                                exchange.getRequest().getPath(), result.getReason().getValue());
                        return Mono.empty();
                    }
                    return Mono.just((SecurityContext) new SecurityContextImpl(
                            new SessionAuthenticationToken(result.getSession())));
                });
    }

    private boolean isTrustedCaller(String presented) {
        String expected = properties.getTrustedCallerToken();
        if (!StringUtils.hasText(expected)) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
