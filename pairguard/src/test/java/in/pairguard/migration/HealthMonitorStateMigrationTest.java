package in.pairguard.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthMonitorStateMigrationTest {

    @Mock private DataSource dataSource;
    @Mock private Connection connection;
    @Mock private DatabaseMetaData metadata;
    @Mock private ResultSet tables;
    @Mock private Statement statement;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metadata);
        when(metadata.getTables(isNull(), isNull(), eq(HealthMonitorStateMigration.TABLE_NAME), any()))
            .thenReturn(tables);
    }

    @Test
    void testCreatesMissingTable() throws SQLException {
        when(tables.next()).thenReturn(false);
        when(connection.createStatement()).thenReturn(statement);

        new HealthMonitorStateMigration(dataSource).migrate();

        verify(statement).execute(contains("CREATE TABLE IF NOT EXISTS health_monitor_state"));
    }

    @Test
    void testExistingTableIsLeftAlone() throws SQLException {
        when(tables.next()).thenReturn(true);

        new HealthMonitorStateMigration(dataSource).migrate();

        verify(connection, never()).createStatement();
    }

    @Test
    void testFailureIsRaised() throws SQLException {
        when(tables.next()).thenReturn(false);
        when(connection.createStatement()).thenThrow(new SQLException("permission denied"));

        RuntimeException e = assertThrows(RuntimeException.class,
            () -> new HealthMonitorStateMigration(dataSource).migrate());
        assertInstanceOf(SQLException.class, e.getCause());
    }
}
