package io.deadswitch.security;

/**
 * Masks credentials and addresses before they reach the logs.
 */
public final class LogSanitizer {

    private static final int TOKEN_PREFIX = 8;

    /**
     * First 8 characters followed by "...".
     */
    public static String token(String token) {
        if (token == null || token.isEmpty()) {
            return "<none>";
        }
        if (token.length() <= TOKEN_PREFIX) {
            return "***";
        }
        return token.substring(0, TOKEN_PREFIX) + "...";
    }

    /**
     * j***@example.com
     */
    public static String email(String email) {
        if (email == null || email.isEmpty()) {
            return "<none>";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }

    private LogSanitizer() {}
}
