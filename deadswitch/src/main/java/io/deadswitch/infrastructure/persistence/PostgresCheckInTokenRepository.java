package io.deadswitch.infrastructure.persistence;

import io.deadswitch.application.port.output.CheckInTokenRepository;
import io.deadswitch.domain.model.CheckInToken;
import io.deadswitch.security.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static io.deadswitch.infrastructure.persistence.JdbcSupport.getInstant;
import static io.deadswitch.infrastructure.persistence.JdbcSupport.setTimestampOrNull;

/**
 * PostgreSQL implementation of CheckInTokenRepository.
 *
 * CRITICAL: consume() runs the token update, deadline reset, history insert
 * and reminder supersession in one transaction. The token update is
 * conditional on used_at IS NULL, so exactly one request wins.
 */
public final class PostgresCheckInTokenRepository implements CheckInTokenRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresCheckInTokenRepository.class);

    private final DataSource dataSource;

    public PostgresCheckInTokenRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<CheckInToken> findByToken(String token) {
        String sql = """
                SELECT id, secret_id, token, expires_at, used_at, created_at
                FROM check_in_tokens
                WHERE token = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, token);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[TOKENS] Failed to find token {}: {}", LogSanitizer.token(token), e.getMessage());
            throw new RuntimeException("Failed to find check-in token", e);
        }
        return Optional.empty();
    }

    @Override
    public void insert(CheckInToken token) {
        String sql = """
                INSERT INTO check_in_tokens (id, secret_id, token, expires_at, used_at, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, token.id());
            ps.setString(2, token.secretId());
            ps.setString(3, token.token());
            ps.setTimestamp(4, Timestamp.from(token.expiresAt()));
            setTimestampOrNull(ps, 5, token.usedAt());
            ps.setTimestamp(6, Timestamp.from(token.createdAt()));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("[TOKENS] Failed to insert token for secret {}: {}", token.secretId(), e.getMessage());
            throw new RuntimeException("Failed to insert check-in token", e);
        }
    }

    @Override
    public ConsumeOutcome consume(String token, String secretId, String userId, Instant now, Instant nextCheckIn) {
        String markUsedSql = """
                UPDATE check_in_tokens
                SET used_at = ?
                WHERE token = ?
                  AND used_at IS NULL
                """;
        String resetSql = """
                UPDATE secrets
                SET last_check_in = ?,
                    next_check_in = ?,
                    updated_at = ?
                WHERE id = ?
                  AND status <> 'triggered'
                """;
        String historySql = """
                INSERT INTO checkin_history (id, secret_id, user_id, checked_in_at, next_check_in)
                VALUES (?, ?, ?, ?, ?)
                """;
        String supersedeSql = """
                UPDATE reminder_jobs
                SET status = 'cancelled'
                WHERE secret_id = ?
                  AND cycle_started_at < ?
                  AND status = 'failed'
                """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(markUsedSql)) {
                    ps.setTimestamp(1, Timestamp.from(now));
                    ps.setString(2, token);
                    if (ps.executeUpdate() == 0) {
                        conn.rollback();
                        log.warn("[TOKENS] Token {} already consumed", LogSanitizer.token(token));
                        return ConsumeOutcome.ALREADY_USED;
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(resetSql)) {
                    ps.setTimestamp(1, Timestamp.from(now));
                    ps.setTimestamp(2, Timestamp.from(nextCheckIn));
                    ps.setTimestamp(3, Timestamp.from(now));
                    ps.setString(4, secretId);
                    if (ps.executeUpdate() == 0) {
                        conn.rollback();
                        log.warn("[TOKENS] Secret {} is triggered or gone, check-in rolled back", secretId);
                        return ConsumeOutcome.SECRET_TRIGGERED;
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(historySql)) {
                    ps.setString(1, UUID.randomUUID().toString());
                    ps.setString(2, secretId);
                    ps.setString(3, userId);
                    ps.setTimestamp(4, Timestamp.from(now));
                    ps.setTimestamp(5, Timestamp.from(nextCheckIn));
                    ps.executeUpdate();
                }

                try (PreparedStatement ps = conn.prepareStatement(supersedeSql)) {
                    ps.setString(1, secretId);
                    ps.setTimestamp(2, Timestamp.from(now));
                    ps.executeUpdate();
                }

                conn.commit();
                return ConsumeOutcome.CONSUMED;

            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("[TOKENS] Failed to consume token {}: {}", LogSanitizer.token(token), e.getMessage());
            throw new RuntimeException("Failed to consume check-in token", e);
        }
    }

    @Override
    public boolean markUsedIfUnused(String token, Instant now) {
        String sql = """
                UPDATE check_in_tokens
                SET used_at = ?
                WHERE token = ?
                  AND used_at IS NULL
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            ps.setString(2, token);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("[TOKENS] Failed to mark token {} used: {}", LogSanitizer.token(token), e.getMessage());
            throw new RuntimeException("Failed to mark check-in token used", e);
        }
    }

    @Override
    public int deleteExpiredUnused(Instant now) {
        String sql = """
                DELETE FROM check_in_tokens
                WHERE expires_at < ?
                  AND used_at IS NULL
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("[TOKENS] Failed to delete expired tokens: {}", e.getMessage());
            throw new RuntimeException("Failed to delete expired check-in tokens", e);
        }
    }

    static CheckInToken mapRow(ResultSet rs) throws SQLException {
        return new CheckInToken(
                rs.getString("id"),
                rs.getString("secret_id"),
                rs.getString("token"),
                getInstant(rs, "expires_at"),
                getInstant(rs, "used_at"),
                getInstant(rs, "created_at"));
    }
}
