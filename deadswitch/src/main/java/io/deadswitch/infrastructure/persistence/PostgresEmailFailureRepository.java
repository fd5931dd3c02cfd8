package io.deadswitch.infrastructure.persistence;

import io.deadswitch.application.port.output.EmailFailureRepository;
import io.deadswitch.domain.model.EmailFailure;
import io.deadswitch.domain.model.EmailType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.deadswitch.infrastructure.persistence.JdbcSupport.getInstant;
import static io.deadswitch.infrastructure.persistence.JdbcSupport.setTimestampOrNull;

/**
 * PostgreSQL implementation of EmailFailureRepository.
 */
public final class PostgresEmailFailureRepository implements EmailFailureRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEmailFailureRepository.class);

    private final DataSource dataSource;

    public PostgresEmailFailureRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public long insert(EmailFailure failure) {
        String sql = """
                INSERT INTO email_failures (
                    email_type, provider, recipient, subject, error_message,
                    retry_count, created_at, resolved_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                RETURNING id
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, failure.emailType().dbValue());
            ps.setString(2, failure.provider());
            ps.setString(3, failure.recipient());
            ps.setString(4, failure.subject());
            ps.setString(5, failure.errorMessage());
            ps.setInt(6, failure.retryCount());
            ps.setTimestamp(7, Timestamp.from(failure.createdAt()));
            setTimestampOrNull(ps, 8, failure.resolvedAt());

            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to insert failure: {}", e.getMessage());
            throw new RuntimeException("Failed to insert email failure", e);
        }
    }

    @Override
    public Optional<EmailFailure> findById(long id) {
        String sql = """
                SELECT * FROM email_failures
                WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to find failure {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to find email failure", e);
        }
        return Optional.empty();
    }

    @Override
    public Optional<EmailFailure> findUnresolved(EmailType emailType, String recipient, String subject) {
        String sql = """
                SELECT * FROM email_failures
                WHERE email_type = ?
                  AND recipient = ?
                  AND subject = ?
                  AND resolved_at IS NULL
                ORDER BY created_at DESC
                LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, emailType.dbValue());
            ps.setString(2, recipient);
            ps.setString(3, subject);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to find unresolved failure: {}", e.getMessage());
            throw new RuntimeException("Failed to find unresolved email failure", e);
        }
        return Optional.empty();
    }

    @Override
    public int incrementRetryCount(long id, String errorMessage) {
        String sql = """
                UPDATE email_failures
                SET retry_count = retry_count + 1,
                    error_message = ?
                WHERE id = ?
                RETURNING retry_count
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, errorMessage);
            ps.setLong(2, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to increment retry count for {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to increment retry count", e);
        }
        throw new IllegalStateException("Email failure " + id + " disappeared during retry increment");
    }

    @Override
    public boolean markResolved(long id, Instant resolvedAt) {
        String sql = """
                UPDATE email_failures
                SET resolved_at = ?
                WHERE id = ?
                  AND resolved_at IS NULL
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(resolvedAt));
            ps.setLong(2, id);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to resolve failure {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to resolve email failure", e);
        }
    }

    @Override
    public int resolveMatching(EmailType emailType, String recipient, String subject, Instant resolvedAt) {
        String sql = """
                UPDATE email_failures
                SET resolved_at = ?
                WHERE email_type = ?
                  AND recipient = ?
                  AND subject = ?
                  AND resolved_at IS NULL
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(resolvedAt));
            ps.setString(2, emailType.dbValue());
            ps.setString(3, recipient);
            ps.setString(4, subject);
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to resolve matching failures: {}", e.getMessage());
            throw new RuntimeException("Failed to resolve matching email failures", e);
        }
    }

    @Override
    public int deleteResolvedBefore(Instant cutoff) {
        String sql = """
                DELETE FROM email_failures
                WHERE resolved_at IS NOT NULL
                  AND resolved_at < ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to clean up failures: {}", e.getMessage());
            throw new RuntimeException("Failed to clean up email failures", e);
        }
    }

    @Override
    public List<EmailFailure> find(Query query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM email_failures WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (query.emailType() != null) {
            sql.append(" AND email_type = ?");
            params.add(query.emailType().dbValue());
        }
        if (query.provider() != null) {
            sql.append(" AND provider = ?");
            params.add(query.provider());
        }
        if (query.recipient() != null) {
            sql.append(" AND recipient = ?");
            params.add(query.recipient());
        }
        if (query.unresolvedOnly()) {
            sql.append(" AND resolved_at IS NULL");
        }
        sql.append(" ORDER BY created_at DESC LIMIT ? OFFSET ?");
        params.add(query.limit());
        params.add(query.offset());

        List<EmailFailure> failures = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    failures.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to list failures: {}", e.getMessage());
            throw new RuntimeException("Failed to list email failures", e);
        }
        return failures;
    }

    @Override
    public Stats stats() {
        String totalsSql = """
                SELECT COUNT(*) AS total,
                       COUNT(*) FILTER (WHERE resolved_at IS NULL) AS unresolved
                FROM email_failures
                """;

        try (Connection conn = dataSource.getConnection()) {
            long total = 0;
            long unresolved = 0;
            try (PreparedStatement ps = conn.prepareStatement(totalsSql);
                    ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    total = rs.getLong("total");
                    unresolved = rs.getLong("unresolved");
                }
            }
            Map<String, Long> byProvider = countBy(conn, "provider");
            Map<String, Long> byType = countBy(conn, "email_type");
            return new Stats(total, unresolved, byProvider, byType);

        } catch (SQLException e) {
            log.error("[EMAIL FAILURES] Failed to compute stats: {}", e.getMessage());
            throw new RuntimeException("Failed to compute email failure stats", e);
        }
    }

    private static Map<String, Long> countBy(Connection conn, String column) throws SQLException {
        // column is one of two fixed names, never user input
        String sql = "SELECT " + column + " AS k, COUNT(*) AS n FROM email_failures GROUP BY " + column + " ORDER BY " + column;
        Map<String, Long> counts = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString("k"), rs.getLong("n"));
            }
        }
        return counts;
    }

    static EmailFailure mapRow(ResultSet rs) throws SQLException {
        return new EmailFailure(
                rs.getLong("id"),
                EmailType.fromDb(rs.getString("email_type")),
                rs.getString("provider"),
                rs.getString("recipient"),
                rs.getString("subject"),
                rs.getString("error_message"),
                rs.getInt("retry_count"),
                getInstant(rs, "created_at"),
                getInstant(rs, "resolved_at"));
    }
}
