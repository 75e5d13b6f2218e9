package com.techStack.sessionGuard.service.user;

import com.techStack.sessionGuard.repository.user.CredentialVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * BCrypt comparison runs on the bounded-elastic pool; it is deliberately slow.
 */
@Service
@RequiredArgsConstructor
public class BCryptCredentialVerifier implements CredentialVerifier {

    private final PasswordEncoder passwordEncoder;

    @Override
    public Mono<Boolean> verifyPassword(String plaintext, String hash) {
        if (plaintext == null || hash == null) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> passwordEncoder.matches(plaintext, hash))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
