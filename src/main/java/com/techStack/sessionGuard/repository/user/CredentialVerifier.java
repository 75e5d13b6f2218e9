package com.techStack.sessionGuard.repository.user;

import reactor.core.publisher.Mono;

public interface CredentialVerifier {

    Mono<Boolean> verifyPassword(String plaintext, String hash);
}
