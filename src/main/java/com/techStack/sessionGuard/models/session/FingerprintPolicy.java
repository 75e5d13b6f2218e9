package com.techStack.sessionGuard.models.session;

/**
 * How session validation treats a device fingerprint that differs from the one
 * recorded at creation.
 */
public enum FingerprintPolicy {
    IGNORE,
    LOG,
    ENFORCE
}
