package com.techStack.sessionGuard.service.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.techStack.sessionGuard.config.CaptchaProperties;
import com.techStack.sessionGuard.repository.security.CaptchaVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * CAPTCHA verification against a siteverify-style endpoint: form post of
 * secret, response and remote ip, JSON answer with a boolean "success".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpCaptchaVerifier implements CaptchaVerifier {

    private final WebClient webClient;
    private final CaptchaProperties properties;

    @Override
    public Mono<Boolean> verify(String token, String ip) {
        if (!StringUtils.hasText(token)) {
            return Mono.just(false);
        }
        if (!StringUtils.hasText(properties.getVerifyUrl())) {
            return Mono.error(new IllegalStateException("CAPTCHA provider is not configured"));
        }

        return webClient.post()
                .uri(properties.getVerifyUrl())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("secret", nullToEmpty(properties.getSecret()))
                        .with("response", token)
                        .with("remoteip", nullToEmpty(ip)))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getTimeout())
                .map(body -> body.path("success").asBoolean(false))
                .doOnNext(success -> log.debug("CAPTCHA verification result: {}", success));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
