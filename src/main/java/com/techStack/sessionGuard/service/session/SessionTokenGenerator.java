package com.techStack.sessionGuard.service.session;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Instant;

/**
 * Generates session ids and remember-me tokens.
 */
@Component
public class SessionTokenGenerator {

    private static final int SESSION_ID_BYTES = 32;
    private static final int TOKEN_ENTROPY_BYTES = 16;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * 32 random bytes, hex encoded.
     */
    public String newSessionId() {
        return Hex.encodeHexString(randomBytes(SESSION_ID_BYTES));
    }

    /**
     * Raw remember-me token: SHA-256 over the session id, the creation time and fresh entropy.
     */
    public String newRememberMeToken(String sessionId, Instant createdAt) {
        String material = sessionId + ":" + createdAt.toEpochMilli() + ":"
                + Hex.encodeHexString(randomBytes(TOKEN_ENTROPY_BYTES));
        return DigestUtils.sha256Hex(material);
    }

    /**
     * Only this hash is stored; the raw token lives in the cookie.
     */
    public String hashToken(String rawToken) {
        return DigestUtils.sha256Hex(rawToken);
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }
}
