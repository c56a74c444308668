package in.pairguard.infrastructure.persistence;

import in.pairguard.application.port.output.KeyValueStore;
import in.pairguard.application.port.output.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Optional;

/**
 * PostgreSQL implementation of KeyValueStore backed by the health_monitor_state table.
 */
public final class PostgresKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresKeyValueStore.class);

    private final DataSource dataSource;

    public PostgresKeyValueStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT value FROM health_monitor_state WHERE key = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("value"));
                }
            }
        } catch (Exception e) {
            log.error("Failed to read health monitor state {}: {}", key, e.getMessage());
            throw new StateStoreException(key, "Failed to read health monitor state", e);
        }
        return Optional.empty();
    }

    @Override
    public void set(String key, String value) {
        String sql = """
                INSERT INTO health_monitor_state (key, value, updated_at)
                VALUES (?, ?, NOW())
                ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();

            log.debug("Stored health monitor state {}", key);

        } catch (Exception e) {
            log.error("Failed to write health monitor state {}: {}", key, e.getMessage());
            throw new StateStoreException(key, "Failed to write health monitor state", e);
        }
    }

    @Override
    public void delete(String key) {
        String sql = "DELETE FROM health_monitor_state WHERE key = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Failed to delete health monitor state {}: {}", key, e.getMessage());
            throw new StateStoreException(key, "Failed to delete health monitor state", e);
        }
    }
}
