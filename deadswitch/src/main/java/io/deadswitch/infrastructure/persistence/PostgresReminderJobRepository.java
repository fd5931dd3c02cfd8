package io.deadswitch.infrastructure.persistence;

import io.deadswitch.application.port.output.ReminderJobRepository;
import io.deadswitch.domain.model.ReminderJob;
import io.deadswitch.domain.model.ReminderTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

import static io.deadswitch.infrastructure.persistence.JdbcSupport.setTimestampOrNull;

/**
 * PostgreSQL implementation of ReminderJobRepository.
 *
 * ENFORCEMENT:
 * - Unique constraint (secret_id, reminder_type, cycle_started_at) makes
 *   record() idempotent across overlapping runs
 */
public final class PostgresReminderJobRepository implements ReminderJobRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresReminderJobRepository.class);

    private final DataSource dataSource;

    public PostgresReminderJobRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Set<ReminderTier> findRecordedTiers(String secretId, Instant cycleStartedAt) {
        String sql = """
                SELECT reminder_type
                FROM reminder_jobs
                WHERE secret_id = ?
                  AND cycle_started_at = ?
                  AND status IN ('sent', 'failed')
                """;

        Set<ReminderTier> tiers = EnumSet.noneOf(ReminderTier.class);
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, secretId);
            ps.setTimestamp(2, Timestamp.from(cycleStartedAt));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tiers.add(ReminderTier.fromDb(rs.getString("reminder_type")));
                }
            }
        } catch (SQLException e) {
            log.error("[REMINDER JOBS] Failed to load tiers for secret {}: {}", secretId, e.getMessage());
            throw new RuntimeException("Failed to load reminder jobs", e);
        }
        return tiers;
    }

    @Override
    public boolean record(ReminderJob job) {
        String sql = """
                INSERT INTO reminder_jobs (
                    id, secret_id, reminder_type, cycle_started_at, scheduled_for,
                    status, sent_at, failed_at, error
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (secret_id, reminder_type, cycle_started_at) DO NOTHING
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant handledAt = job.sentAt() != null ? job.sentAt() : job.failedAt();
            ps.setString(1, job.id());
            ps.setString(2, job.secretId());
            ps.setString(3, job.tier().dbValue());
            ps.setTimestamp(4, Timestamp.from(job.cycleStartedAt()));
            setTimestampOrNull(ps, 5, handledAt);
            ps.setString(6, job.status().dbValue());
            setTimestampOrNull(ps, 7, job.sentAt());
            setTimestampOrNull(ps, 8, job.failedAt());
            ps.setString(9, job.error());

            boolean inserted = ps.executeUpdate() > 0;
            if (!inserted) {
                log.debug("[REMINDER JOBS] {} already recorded for secret {}", job.tier().dbValue(), job.secretId());
            }
            return inserted;

        } catch (SQLException e) {
            log.error("[REMINDER JOBS] Failed to record {} for secret {}: {}",
                job.tier().dbValue(), job.secretId(), e.getMessage());
            throw new RuntimeException("Failed to record reminder job", e);
        }
    }
}
