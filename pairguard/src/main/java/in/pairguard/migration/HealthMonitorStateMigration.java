package in.pairguard.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Health Monitor State Migration - Creates the state table on startup.
 *
 * health_monitor_state holds the supervisor's pairing bookkeeping
 * (pairing_state, last_pairing_request_time, consecutive_failures)
 * so recovery in progress survives a restart.
 */
public final class HealthMonitorStateMigration {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitorStateMigration.class);

    static final String TABLE_NAME = "health_monitor_state";

    private final DataSource dataSource;

    public HealthMonitorStateMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates the table if it doesn't exist.
     */
    public void migrate() {
        log.info("[STATE MIGRATION] Starting health monitor state migration");

        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, TABLE_NAME)) {
                log.info("[STATE MIGRATION] {} table already exists", TABLE_NAME);
                return;
            }

            log.info("[STATE MIGRATION] Creating {} table...", TABLE_NAME);
            createStateTable(conn);
            log.info("[STATE MIGRATION] ✓ {} table created", TABLE_NAME);

        } catch (Exception e) {
            log.error("[STATE MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Health monitor state migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createStateTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE IF NOT EXISTS health_monitor_state (
                key TEXT PRIMARY KEY,
                value TEXT NOT NULL,
                updated_at TIMESTAMPTZ DEFAULT NOW()
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
