package io.deadswitch.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-secret bearer check for the cron trigger and the admin API.
 *
 * The header value is trimmed, the scheme must be "Bearer" and the token is
 * compared byte for byte (case-sensitive, constant time) with the configured
 * secret. An unset secret rejects every request.
 */
public final class BearerAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(BearerAuthenticator.class);

    private static final String SCHEME = "Bearer";

    private final String realm;
    private final byte[] expected;

    /**
     * @param realm  Log tag, e.g. "CRON"
     * @param secret Configured secret, may be empty
     */
    public BearerAuthenticator(String realm, String secret) {
        this.realm = realm;
        this.expected = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param authorizationHeader Raw Authorization header value, may be null
     */
    public boolean isAuthorized(String authorizationHeader) {
        if (expected.length == 0) {
            log.warn("[{} AUTH] No secret configured, rejecting request", realm);
            return false;
        }
        if (authorizationHeader == null) {
            log.warn("[{} AUTH] Missing Authorization header", realm);
            return false;
        }
        String value = authorizationHeader.trim();
        if (value.length() <= SCHEME.length()
                || !value.regionMatches(false, 0, SCHEME, 0, SCHEME.length())
                || !Character.isWhitespace(value.charAt(SCHEME.length()))) {
            log.warn("[{} AUTH] Malformed Authorization header", realm);
            return false;
        }
        String token = value.substring(SCHEME.length()).trim();
        if (token.isEmpty()) {
            log.warn("[{} AUTH] Empty bearer token", realm);
            return false;
        }
        boolean matches = MessageDigest.isEqual(expected, token.getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            log.warn("[{} AUTH] Invalid bearer token {}", realm, LogSanitizer.token(token));
        }
        return matches;
    }
}
