package com.techStack.sessionGuard.service.auth;

import com.techStack.sessionGuard.dto.internal.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetSocketAddress;
import java.util.regex.Pattern;

import static com.techStack.sessionGuard.constants.SecurityConstants.*;

/**
 * Request Context Resolver
 *
 * Resolves the client IP, user agent and device fingerprint of a request.
 * IP resolution never fails: direct address, then X-Forwarded-For, then
 * X-Real-IP, then the "unknown" sentinel. Behind a trusted proxy the
 * forwarded headers are consulted first.
 */
@Slf4j
@Service
public class RequestContextResolver {

    private static final Pattern IPV4_PATTERN = Pattern.compile("^([0-9]{1,3}\\.){3}[0-9]{1,3}$");
    private static final Pattern IPV6_PATTERN = Pattern.compile("^[0-9a-fA-F:]+$");
    private static final int FINGERPRINT_LENGTH = 32;

    @Value("${security.client-ip.trust-forwarded-headers:false}")
    private boolean trustForwardedHeaders;

    public RequestContextResolver() {
    }

    RequestContextResolver(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public RequestContext resolve(ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        String userAgent = request.getHeaders().getFirst(HttpHeaders.USER_AGENT);

        return RequestContext.builder()
                .ip(extractClientIp(exchange))
                .userAgent(StringUtils.hasText(userAgent) ? userAgent : UNKNOWN_USER_AGENT)
                .deviceFingerprint(resolveDeviceFingerprint(request))
                .path(request.getPath().value())
                .build();
    }

    /* =========================
       Client IP
       ========================= */

    public String extractClientIp(ServerWebExchange exchange) {
        try {
            ServerHttpRequest request = exchange.getRequest();
            String direct = directAddress(request);
            String forwarded = firstForwardedHop(request.getHeaders().getFirst(HEADER_FORWARDED_FOR));
            String realIp = validOrNull(request.getHeaders().getFirst(HEADER_REAL_IP));

            String resolved = trustForwardedHeaders
                    ? firstNonNull(forwarded, realIp, direct)
                    : firstNonNull(direct, forwarded, realIp);

            if (resolved == null) {
                log.debug("Could not resolve client IP for {}, using sentinel", request.getPath().value());
                return UNKNOWN_IP;
            }
            return normalizeIp(resolved);
        } catch (Exception ex) {
            log.warn("IP extraction failed: {}", ex.getMessage());
            return UNKNOWN_IP;
        }
    }

    private String directAddress(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return null;
    }

    private String firstForwardedHop(String forwardedIps) {
        if (!StringUtils.hasText(forwardedIps)) {
            return null;
        }
        for (String ip : forwardedIps.split(",")) {
            String candidate = validOrNull(ip);
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private String validOrNull(String ip) {
        if (!StringUtils.hasText(ip)) {
            return null;
        }
        String clean = ip.trim();
        return IPV4_PATTERN.matcher(clean).matches() || IPV6_PATTERN.matcher(clean).matches() ? clean : null;
    }

    private String firstNonNull(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    public String normalizeIp(String ip) {
        if (!StringUtils.hasText(ip)) {
            return UNKNOWN_IP;
        }

        String normalized = ip.trim();
        if ("0:0:0:0:0:0:0:1".equals(normalized) || "::1".equals(normalized)) {
            return "127.0.0.1";
        }
        if (normalized.contains("%")) {
            normalized = normalized.substring(0, normalized.indexOf('%'));
        }
        return normalized;
    }

    /* =========================
       Device Fingerprint
       ========================= */

    /**
     * Client-supplied fingerprint when present, otherwise a hash of the
     * user agent and the content negotiation headers.
     */
    public String resolveDeviceFingerprint(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        String supplied = headers.getFirst(HEADER_DEVICE_FINGERPRINT);
        if (StringUtils.hasText(supplied)) {
            return supplied.trim();
        }
        return generateDeviceFingerprint(
                headers.getFirst(HttpHeaders.USER_AGENT),
                headers.getFirst(HttpHeaders.ACCEPT_LANGUAGE),
                headers.getFirst(HttpHeaders.ACCEPT_ENCODING));
    }

    public String generateDeviceFingerprint(String userAgent, String acceptLanguage, String acceptEncoding) {
        String input = nullToEmpty(userAgent) + "|" + nullToEmpty(acceptLanguage) + "|" + nullToEmpty(acceptEncoding);
        return DigestUtils.sha256Hex(input).substring(0, FINGERPRINT_LENGTH);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
