package com.techStack.sessionGuard.repository.security;

import reactor.core.publisher.Mono;

/**
 * Verifies a CAPTCHA response token with the external provider. An error
 * signal means the provider could not be reached.
 */
public interface CaptchaVerifier {

    Mono<Boolean> verify(String token, String ip);
}
