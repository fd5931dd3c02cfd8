package io.deadswitch.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema Migration - creates the disclosure engine's tables on startup.
 *
 * Tables, in dependency order:
 * - users: account holders (owned by the account service, created here if missing)
 * - secrets: deposited secrets and their deadlines
 * - check_in_tokens: single-use check-in credentials
 * - checkin_history: one row per successful check-in
 * - reminder_jobs: reminder dedupe records per check-in cycle
 * - email_failures: delivery failures for escalation
 *
 * Rows referencing a secret are deleted with it (ON DELETE CASCADE).
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create missing tables. Existing tables are left untouched.
     */
    public void migrate() {
        log.info("[MIGRATION] Starting schema migration");

        try (Connection conn = dataSource.getConnection()) {
            for (Map.Entry<String, String> table : tables().entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.info("[MIGRATION] {} table already exists", table.getKey());
                    continue;
                }
                log.info("[MIGRATION] Creating {} table...", table.getKey());
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(table.getValue());
                }
                log.info("[MIGRATION] ✓ {} table created", table.getKey());
            }
            log.info("[MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    static Map<String, String> tables() {
        Map<String, String> tables = new LinkedHashMap<>();

        tables.put("users", """
            CREATE TABLE users (
                id VARCHAR(64) PRIMARY KEY,
                email VARCHAR(320) NOT NULL UNIQUE,
                name VARCHAR(255),
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("secrets", """
            CREATE TABLE secrets (
                id VARCHAR(64) PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                title VARCHAR(255) NOT NULL,
                recipients JSONB NOT NULL DEFAULT '[]'::jsonb,
                check_in_days INT NOT NULL DEFAULT 30 CHECK (check_in_days > 0),
                status VARCHAR(16) NOT NULL DEFAULT 'active'
                    CHECK (status IN ('active', 'paused', 'triggered')),

                -- Encrypted server share, NULL once deleted (secret disabled)
                server_share TEXT,
                iv TEXT,
                auth_tag TEXT,
                sss_shares_total INT NOT NULL DEFAULT 3,
                sss_threshold INT NOT NULL DEFAULT 2,

                is_triggered BOOLEAN NOT NULL DEFAULT FALSE,
                last_check_in TIMESTAMPTZ,
                next_check_in TIMESTAMPTZ,
                triggered_at TIMESTAMPTZ,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            );
            CREATE INDEX idx_secrets_active_next_check_in
                ON secrets (next_check_in) WHERE status = 'active'
            """);

        tables.put("check_in_tokens", """
            CREATE TABLE check_in_tokens (
                id VARCHAR(64) PRIMARY KEY,
                secret_id VARCHAR(64) NOT NULL REFERENCES secrets(id) ON DELETE CASCADE,
                token VARCHAR(128) NOT NULL UNIQUE,
                expires_at TIMESTAMPTZ NOT NULL,
                used_at TIMESTAMPTZ,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("checkin_history", """
            CREATE TABLE checkin_history (
                id VARCHAR(64) PRIMARY KEY,
                secret_id VARCHAR(64) NOT NULL REFERENCES secrets(id) ON DELETE CASCADE,
                user_id VARCHAR(64) NOT NULL,
                checked_in_at TIMESTAMPTZ NOT NULL,
                next_check_in TIMESTAMPTZ NOT NULL
            )
            """);

        tables.put("reminder_jobs", """
            CREATE TABLE reminder_jobs (
                id VARCHAR(64) PRIMARY KEY,
                secret_id VARCHAR(64) NOT NULL REFERENCES secrets(id) ON DELETE CASCADE,
                reminder_type VARCHAR(16) NOT NULL,
                cycle_started_at TIMESTAMPTZ NOT NULL,
                scheduled_for TIMESTAMPTZ,
                status VARCHAR(16) NOT NULL CHECK (status IN ('sent', 'failed', 'cancelled')),
                sent_at TIMESTAMPTZ,
                failed_at TIMESTAMPTZ,
                error TEXT,
                CONSTRAINT uq_reminder_jobs_cycle UNIQUE (secret_id, reminder_type, cycle_started_at)
            )
            """);

        tables.put("email_failures", """
            CREATE TABLE email_failures (
                id BIGSERIAL PRIMARY KEY,
                email_type VARCHAR(32) NOT NULL,
                provider VARCHAR(32) NOT NULL,
                recipient VARCHAR(320) NOT NULL,
                subject TEXT NOT NULL,
                error_message TEXT NOT NULL,
                retry_count INT NOT NULL DEFAULT 0,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                resolved_at TIMESTAMPTZ
            );
            CREATE INDEX idx_email_failures_unresolved
                ON email_failures (email_type, recipient) WHERE resolved_at IS NULL
            """);

        return tables;
    }
}
