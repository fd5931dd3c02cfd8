package io.deadswitch.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.deadswitch.application.port.output.SecretRepository;
import io.deadswitch.domain.model.Recipient;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.model.SecretStatus;
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
import java.util.List;
import java.util.Optional;

import static io.deadswitch.infrastructure.persistence.JdbcSupport.getInstant;

/**
 * PostgreSQL implementation of SecretRepository.
 *
 * Rows are converted to Secret only through mapRow(); recipients are a JSONB
 * array of {name, email, phone}.
 */
public final class PostgresSecretRepository implements SecretRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSecretRepository.class);

    private static final TypeReference<List<Recipient>> RECIPIENTS = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public PostgresSecretRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Secret> findById(String secretId) {
        String sql = """
                SELECT * FROM secrets
                WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, secretId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs, objectMapper));
                }
            }
        } catch (SQLException e) {
            log.error("[SECRETS] Failed to find secret {}: {}", secretId, e.getMessage());
            throw new RuntimeException("Failed to find secret", e);
        }
        return Optional.empty();
    }

    @Override
    public List<Secret> findSchedulerCandidates(Instant now, Instant lookaheadUntil) {
        String sql = """
                SELECT * FROM secrets
                WHERE status = 'active'
                  AND next_check_in IS NOT NULL
                  AND (next_check_in <= ?
                       OR next_check_in - CAST(? AS TIMESTAMPTZ) <= check_in_days * INTERVAL '12 hours')
                ORDER BY next_check_in ASC
                """;

        List<Secret> secrets = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(lookaheadUntil));
            ps.setTimestamp(2, Timestamp.from(now));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    secrets.add(mapRow(rs, objectMapper));
                }
            }
        } catch (SQLException e) {
            log.error("[SECRETS] Failed to load scheduler candidates: {}", e.getMessage());
            throw new RuntimeException("Failed to load scheduler candidates", e);
        }
        return secrets;
    }

    @Override
    public boolean markTriggered(String secretId, Instant dueAt, Instant triggeredAt) {
        String sql = """
                UPDATE secrets
                SET status = 'triggered',
                    is_triggered = TRUE,
                    triggered_at = ?,
                    updated_at = ?
                WHERE id = ?
                  AND status = 'active'
                  AND next_check_in <= ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(triggeredAt));
            ps.setTimestamp(2, Timestamp.from(triggeredAt));
            ps.setString(3, secretId);
            ps.setTimestamp(4, Timestamp.from(dueAt));

            int updated = ps.executeUpdate();
            if (updated > 0) {
                log.info("[SECRETS] Secret {} marked triggered", secretId);
                return true;
            }
            return false;
        } catch (SQLException e) {
            log.error("[SECRETS] Failed to mark secret {} triggered: {}", secretId, e.getMessage());
            throw new RuntimeException("Failed to mark secret triggered", e);
        }
    }

    static Secret mapRow(ResultSet rs, ObjectMapper objectMapper) throws SQLException {
        return new Secret(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("title"),
                readRecipients(rs.getString("recipients"), objectMapper),
                rs.getInt("check_in_days"),
                SecretStatus.fromDb(rs.getString("status")),
                rs.getString("server_share"),
                rs.getString("iv"),
                rs.getString("auth_tag"),
                getInstant(rs, "last_check_in"),
                getInstant(rs, "next_check_in"),
                getInstant(rs, "triggered_at"),
                getInstant(rs, "created_at"),
                getInstant(rs, "updated_at"));
    }

    private static List<Recipient> readRecipients(String json, ObjectMapper objectMapper) throws SQLException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, RECIPIENTS);
        } catch (JsonProcessingException e) {
            throw new SQLException("Malformed recipients JSON", e);
        }
    }
}
