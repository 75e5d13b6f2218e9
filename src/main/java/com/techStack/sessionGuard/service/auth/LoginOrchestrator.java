package com.techStack.sessionGuard.service.auth;

import com.techStack.sessionGuard.dto.internal.LoginGateRequest;
import com.techStack.sessionGuard.dto.internal.LoginResult;
import com.techStack.sessionGuard.dto.internal.RequestContext;
import com.techStack.sessionGuard.dto.request.LoginRequest;
import com.techStack.sessionGuard.exception.auth.AccountDisabledException;
import com.techStack.sessionGuard.exception.auth.AuthServiceUnavailableException;
import com.techStack.sessionGuard.exception.auth.InvalidCredentialsException;
import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.attempt.AttemptOutcome;
import com.techStack.sessionGuard.models.session.LoginType;
import com.techStack.sessionGuard.models.session.SessionCreationOptions;
import com.techStack.sessionGuard.models.user.UserAccount;
import com.techStack.sessionGuard.repository.user.CredentialVerifier;
import com.techStack.sessionGuard.repository.user.UserDirectory;
import com.techStack.sessionGuard.service.security.LoginSecurityGate;
import com.techStack.sessionGuard.service.session.SessionManager;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Login Orchestrator
 *
 * Password login flow:
 * 1. Security gate (lockout, IP block, CAPTCHA, delay)
 * 2. Optional strict validation
 * 3. User lookup and credential check
 * 4. Outcome recording
 * 5. Session creation
 *
 * Unknown users and wrong passwords are indistinguishable to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginOrchestrator {

    private final LoginSecurityGate securityGate;
    private final UserDirectory userDirectory;
    private final CredentialVerifier credentialVerifier;
    private final SessionManager sessionManager;
    private final Clock clock;

    public Mono<LoginResult> login(LoginRequest request, RequestContext context, String captchaHeader) {
        Instant start = clock.instant();
        String identifier = HelperUtils.normalizeIdentifier(request.getIdentifier());

        LoginGateRequest gateRequest = LoginGateRequest.builder()
                .identifier(identifier)
                .captchaToken(request.getCaptchaToken() != null ? request.getCaptchaToken() : captchaHeader)
                .requestContext(context)
                .build();

        return securityGate.enforce(gateRequest)
                .flatMap(securityGate::validateSecurity)
                .flatMap(securityContext -> authenticate(identifier, request.getPassword(), context)
                        .flatMap(user -> securityGate.recordOutcome(identifier, context, AttemptOutcome.SUCCESS)
                                .then(sessionManager.createSession(user.getId(), context, SessionCreationOptions.builder()
                                        .loginType(LoginType.PASSWORD)
                                        .rememberMe(request.isRememberMe())
                                        .build()))
                                .map(issue -> new LoginResult(user, issue, securityContext))))
                .doOnSuccess(result -> {
                    if (result != null) {
                        log.info("Login succeeded for {} in {}", HelperUtils.maskIdentifier(identifier),
                                Duration.between(start, clock.instant()));
                    }
                });
    }

    /* =========================
       Credential Check
       ========================= */

    private Mono<UserAccount> authenticate(String identifier, String password, RequestContext context) {
        return userDirectory.findUserByIdentifier(identifier)
                .flatMap(user -> credentialVerifier.verifyPassword(password, user.getPasswordHash())
                        .flatMap(matches -> matches ? Mono.just(user) : Mono.<UserAccount>empty()))
                .switchIfEmpty(Mono.defer(() -> securityGate
                        .recordOutcome(identifier, context, AttemptOutcome.INVALID_CREDENTIALS)
                        .then(Mono.<UserAccount>error(new InvalidCredentialsException()))))
                .flatMap(user -> user.canAuthenticate()
                        ? Mono.just(user)
                        : Mono.<UserAccount>error(new AccountDisabledException(user.getStatus())))
                .onErrorResume(e -> !(e instanceof CustomException), e -> {
                    log.error("Credential check failed for {}: {}", HelperUtils.maskIdentifier(identifier), e.getMessage());
                    return securityGate.recordOutcome(identifier, context, AttemptOutcome.SYSTEM_ERROR)
                            .then(Mono.<UserAccount>error(new AuthServiceUnavailableException(e)));
                });
    }
}
