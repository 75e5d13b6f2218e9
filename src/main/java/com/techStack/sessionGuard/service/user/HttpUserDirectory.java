package com.techStack.sessionGuard.service.user;

import com.techStack.sessionGuard.config.UserDirectoryProperties;
import com.techStack.sessionGuard.models.user.UserAccount;
import com.techStack.sessionGuard.repository.user.UserDirectory;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * User lookups against the storefront's internal user API. A 404 is an
 * empty result; any other failure propagates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpUserDirectory implements UserDirectory {

    private final WebClient webClient;
    private final UserDirectoryProperties properties;

    @Override
    public Mono<UserAccount> findUserByIdentifier(String identifier) {
        return webClient.post()
                .uri(properties.getBaseUrl() + properties.getLookupPath())
                .headers(this::authorize)
                .bodyValue(Map.of("identifier", identifier))
                .retrieve()
                .bodyToMono(UserAccount.class)
                .timeout(properties.getTimeout())
                .onErrorResume(WebClientResponseException.class, e -> notFoundAsEmpty(e))
                .doOnNext(user -> log.debug("Resolved user {} for {}", user.getId(), HelperUtils.maskIdentifier(identifier)));
    }

    @Override
    public Mono<UserAccount> findUserById(String id) {
        return webClient.get()
                .uri(properties.getBaseUrl() + properties.getByIdPath(), id)
                .headers(this::authorize)
                .retrieve()
                .bodyToMono(UserAccount.class)
                .timeout(properties.getTimeout())
                .onErrorResume(WebClientResponseException.class, e -> notFoundAsEmpty(e));
    }

    private void authorize(HttpHeaders headers) {
        if (StringUtils.hasText(properties.getServiceToken())) {
            headers.setBearerAuth(properties.getServiceToken());
        }
    }

    private Mono<UserAccount> notFoundAsEmpty(WebClientResponseException e) {
        if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return Mono.empty();
        }
        log.error("User directory call failed with {}: {}", e.getStatusCode(), e.getMessage());
        return Mono.error(e);
    }
}
