package com.techStack.sessionGuard.util.validation;

import java.util.Locale;

/**
 * Helper Utilities
 *
 * Masking for log output and normalisation of login identifiers.
 */
public final class HelperUtils {

    private HelperUtils() {
        // Utility class - private constructor
    }

    /* =========================
       Identifier Utilities
       ========================= */

    /**
     * Trims the identifier and lower-cases e-mail addresses so that
     * "User@X.com" and "user@x.com" share one ledger.
     */
    public static String normalizeIdentifier(String identifier) {
        if (identifier == null) {
            return null;
        }
        String trimmed = identifier.trim();
        return trimmed.contains("@") ? trimmed.toLowerCase(Locale.ROOT) : trimmed;
    }

    public static boolean isEmail(String identifier) {
        return identifier != null && identifier.indexOf('@') > 0;
    }

    public static String emailDomain(String identifier) {
        if (!isEmail(identifier)) {
            return null;
        }
        return identifier.substring(identifier.lastIndexOf('@') + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Masks an e-mail or phone identifier for logging.
     *
     * Examples:
     * john.doe@gmail.com → j*****e@gmail.com
     * +254712345678 → +254*****78
     */
    public static String maskIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) return "*****";

        String trimmed = identifier.trim();
        if (isEmail(trimmed)) {
            return maskEmail(trimmed);
        }
        if (trimmed.length() <= 4) {
            return "*****";
        }
        return trimmed.substring(0, 4) + "*****" + trimmed.substring(trimmed.length() - 2);
    }

    public static String maskEmail(String email) {
        if (email == null || email.trim().isEmpty()) return "*****";

        String trimmedEmail = email.trim();
        int atIndex = trimmedEmail.indexOf('@');
        if (atIndex <= 0) return "*****";

        String localPart = trimmedEmail.substring(0, atIndex);
        String domain = trimmedEmail.substring(atIndex + 1);

        if (localPart.length() == 1) {
            return localPart + "*****@" + domain;
        }
        return localPart.charAt(0) + "*****" + localPart.charAt(localPart.length() - 1) + "@" + domain;
    }

    /* =========================
       IP Utilities
       ========================= */

    /**
     * Masks an IP address for logging
     * 192.168.1.100 → 192.168.***.**
     */
    public static String maskIpAddress(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return "***.***.***.**";
        }

        String ip = ipAddress.trim();
        if (ip.contains(":")) {
            String[] parts = ip.split(":");
            return parts.length < 3 ? "****:****:****" : parts[0] + ":" + parts[1] + ":" + parts[2] + ":****";
        }

        String[] parts = ip.split("\\.");
        if (parts.length != 4) {
            return ip.length() <= 8 ? ip : "***.***.***.**";
        }
        return parts[0] + "." + parts[1] + ".***.**";
    }
}
