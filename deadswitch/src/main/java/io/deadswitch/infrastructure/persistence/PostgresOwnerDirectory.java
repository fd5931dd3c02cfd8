package io.deadswitch.infrastructure.persistence;

import io.deadswitch.application.port.output.OwnerDirectory;
import io.deadswitch.domain.model.Owner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Reads account holders from the users table owned by the account service.
 */
public final class PostgresOwnerDirectory implements OwnerDirectory {
    private static final Logger log = LoggerFactory.getLogger(PostgresOwnerDirectory.class);

    private final DataSource dataSource;

    public PostgresOwnerDirectory(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Owner> findOwner(String userId) {
        String sql = """
                SELECT id, email, name
                FROM users
                WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[OWNERS] Failed to find user {}: {}", userId, e.getMessage());
            throw new RuntimeException("Failed to find owner", e);
        }
        return Optional.empty();
    }

    static Owner mapRow(ResultSet rs) throws SQLException {
        return new Owner(rs.getString("id"), rs.getString("email"), rs.getString("name"));
    }
}
