package com.techStack.sessionGuard.constants;

import java.util.Set;
import java.util.regex.Pattern;

public final class SecurityConstants {

    private SecurityConstants() {}

    /* =========================
       Redis Key Prefixes
       ========================= */

    public static final String LOGIN_ATTEMPTS_KEY_PREFIX = "login_attempts:";
    public static final String IP_ATTEMPTS_KEY_PREFIX = "ip_attempts:";
    public static final String LOGIN_RATE_LIMIT_KEY_PREFIX = "login_rate_limit:";
    public static final String SESSION_KEY_PREFIX = "session:";
    public static final String USER_SESSIONS_KEY_PREFIX = "user_sessions:";
    public static final String REMEMBER_ME_KEY_PREFIX = "remember_me:";
    public static final String USER_REMEMBER_ME_KEY_PREFIX = "user_remember_me:";

    /* =========================
       Cookies
       ========================= */

    public static final String SESSION_COOKIE = "sessionId";
    public static final String REMEMBER_ME_COOKIE = "rememberMe";
    public static final String REMEMBER_ME_ENABLED_COOKIE = "rememberMeEnabled";

    /* =========================
       Login Security Headers
       ========================= */

    public static final String HEADER_LOGIN_SECURITY_ENABLED = "X-Login-Security-Enabled";
    public static final String HEADER_USER_LOCKED = "X-User-Locked";
    public static final String HEADER_IP_BLOCKED = "X-IP-Blocked";
    public static final String HEADER_CAPTCHA_REQUIRED = "X-Captcha-Required";
    public static final String HEADER_SUSPICIOUS_ACTIVITY = "X-Suspicious-Activity";
    public static final String HEADER_PROGRESSIVE_DELAY = "X-Progressive-Delay";
    public static final String HEADER_SECURITY_TIMESTAMP = "X-Security-Timestamp";

    /* =========================
       Session Headers
       ========================= */

    public static final String HEADER_SESSION_ID = "X-Session-ID";
    public static final String HEADER_SESSION_EXPIRES_AT = "X-Session-Expires-At";
    public static final String HEADER_SESSION_MAX_AGE = "X-Session-Max-Age";
    public static final String HEADER_SESSION_SECURITY_LEVEL = "X-Session-Security-Level";

    /* =========================
       Request Headers
       ========================= */

    public static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";
    public static final String HEADER_REAL_IP = "X-Real-IP";
    public static final String HEADER_DEVICE_FINGERPRINT = "X-Device-Fingerprint";
    public static final String HEADER_CAPTCHA_TOKEN = "X-Captcha-Token";
    public static final String HEADER_SERVICE_TOKEN = "X-Service-Token";
    public static final String SESSION_QUERY_PARAM = "session_id";
    public static final String BEARER_PREFIX = "Bearer ";

    /* =========================
       Rate Limit Headers
       ========================= */

    public static final String HEADER_RATE_LIMIT_LIMIT = "X-Login-RateLimit-Limit";
    public static final String HEADER_RATE_LIMIT_REMAINING = "X-Login-RateLimit-Remaining";
    public static final String HEADER_RATE_LIMIT_RESET = "X-Login-RateLimit-Reset";

    /* =========================
       Sentinels
       ========================= */

    public static final String UNKNOWN_IP = "unknown";
    public static final String UNKNOWN_IDENTIFIER = "unknown";
    public static final String UNKNOWN_USER_AGENT = "unknown";

    /* =========================
       Exchange Attributes
       ========================= */

    public static final String ATTR_SECURITY_CONTEXT = "sessionGuard.securityContext";
    public static final String ATTR_SESSION_INVALID_REASON = "sessionGuard.sessionInvalidReason";

    /* =========================
       Suspicious Patterns
       ========================= */

    public static final Pattern MALICIOUS_USER_AGENT_PATTERN = Pattern.compile(
            "bot|crawler|spider|scanner|sqlmap|nikto|nmap|masscan",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern AUTOMATED_TOOL_PATTERN = Pattern.compile(
            "curl|wget|python|java/|node|go-http-client|okhttp",
            Pattern.CASE_INSENSITIVE
    );

    public static final Set<String> DISPOSABLE_EMAIL_DOMAINS = Set.of(
            "mailinator.com", "tempmail.com", "10minutemail.com", "guerrillamail.com",
            "yopmail.com", "throwawaymail.com", "trashmail.com", "getnada.com"
    );
}
