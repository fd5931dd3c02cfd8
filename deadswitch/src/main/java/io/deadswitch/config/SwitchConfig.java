package io.deadswitch.config;

import io.deadswitch.util.Env;

import java.time.Duration;
import java.util.Locale;

/**
 * Process configuration, read once at startup and passed to every component.
 */
public record SwitchConfig(
        String host,
        int port,
        String cronSecret, // Empty = every cron call is rejected
        String adminToken, // Empty = admin API disabled
        EmailProviderType emailProvider,
        String sendGridApiKey,
        String senderEmail,
        String senderName,
        String failureNotificationEmail,
        String siteUrl,
        String encryptionKey, // Base64 AES key for server shares
        String dbUrl,
        String dbUser,
        String dbPass,
        int dbPoolSize,
        int schedulerWorkers,
        Duration schedulerRunTimeout,
        boolean internalSchedulerEnabled,
        Duration internalSchedulerInterval,
        int failureRetentionDays,
        int emailMaxAttempts,
        long emailBaseDelayMs,
        long emailMaxDelayMs
) {
    public static final String DEFAULT_FAILURE_NOTIFICATION_EMAIL = "support@aviat.io";

    /**
     * @throws IllegalStateException if a count or duration that sizes a pool,
     *         a schedule or a retry loop is not positive
     */
    public SwitchConfig {
        requirePositive("DB_POOL_SIZE", dbPoolSize);
        requirePositive("SCHEDULER_WORKERS", schedulerWorkers);
        requirePositive("SCHEDULER_RUN_TIMEOUT_SECONDS", schedulerRunTimeout.getSeconds());
        requirePositive("INTERNAL_SCHEDULER_INTERVAL_MINUTES", internalSchedulerInterval.toMinutes());
        requirePositive("EMAIL_FAILURE_RETENTION_DAYS", failureRetentionDays);
        requirePositive("EMAIL_MAX_ATTEMPTS", emailMaxAttempts);
        if (emailBaseDelayMs <= 0 || emailMaxDelayMs < emailBaseDelayMs) {
            throw new IllegalStateException("Invalid config: EMAIL_BASE_DELAY_MS=" + emailBaseDelayMs
                + " and EMAIL_MAX_DELAY_MS=" + emailMaxDelayMs + " need 0 < base <= max");
        }
    }

    public enum EmailProviderType {
        MOCK,
        SENDGRID;

        public static EmailProviderType parse(String value) {
            if (value == null || value.isBlank()) {
                return MOCK;
            }
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static SwitchConfig fromEnv() {
        return new SwitchConfig(
                Env.get("HOST", "0.0.0.0"),
                Env.getInt("PORT", 8080),
                Env.get("CRON_SECRET", ""),
                Env.get("ADMIN_TOKEN", ""),
                EmailProviderType.parse(Env.get("EMAIL_PROVIDER", "mock")),
                Env.get("SENDGRID_API_KEY", ""),
                Env.get("SENDGRID_ADMIN_EMAIL", "noreply@deadswitch.local"),
                Env.get("SENDGRID_SENDER_NAME", "Dead Man's Switch"),
                Env.get("ADMIN_ALERT_EMAIL", DEFAULT_FAILURE_NOTIFICATION_EMAIL),
                stripTrailingSlash(Env.get("SITE_URL", "http://localhost:3000")),
                Env.get("ENCRYPTION_KEY", ""),
                Env.get("DB_URL", "jdbc:postgresql://localhost:5432/deadswitch"),
                Env.get("DB_USER", "postgres"),
                Env.get("DB_PASS", "postgres"),
                Env.getInt("DB_POOL_SIZE", 10),
                Env.getInt("SCHEDULER_WORKERS", 4),
                Duration.ofSeconds(Env.getInt("SCHEDULER_RUN_TIMEOUT_SECONDS", 120)),
                Env.getBool("INTERNAL_SCHEDULER_ENABLED", false),
                Duration.ofMinutes(Env.getInt("INTERNAL_SCHEDULER_INTERVAL_MINUTES", 5)),
                Env.getInt("EMAIL_FAILURE_RETENTION_DAYS", 30),
                Env.getInt("EMAIL_MAX_ATTEMPTS", 3),
                Env.getLong("EMAIL_BASE_DELAY_MS", 1000),
                Env.getLong("EMAIL_MAX_DELAY_MS", 60_000)
        );
    }

    public boolean hasCronSecret() {
        return cronSecret != null && !cronSecret.isEmpty();
    }

    public boolean hasAdminToken() {
        return adminToken != null && !adminToken.isEmpty();
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalStateException("Invalid config: " + name + " must be positive, got " + value);
        }
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
