package com.techStack.sessionGuard.models.security;

/**
 * States of one pass through the login security gate. LOCKOUT_CHECK and
 * IP_CHECK may end the pass with 423, CAPTCHA_CHECK with 429.
 */
public enum GateState {
    START,
    LOCKOUT_CHECK,
    IP_CHECK,
    SUSPICION_CHECK,
    CAPTCHA_CHECK,
    DELAY,
    PASSTHROUGH
}
