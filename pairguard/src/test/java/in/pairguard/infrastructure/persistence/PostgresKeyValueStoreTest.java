package in.pairguard.infrastructure.persistence;

import in.pairguard.application.port.output.StateStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PostgresKeyValueStore against mocked JDBC.
 */
@ExtendWith(MockitoExtension.class)
class PostgresKeyValueStoreTest {

    @Mock private DataSource dataSource;
    @Mock private Connection connection;
    @Mock private PreparedStatement statement;
    @Mock private ResultSet resultSet;

    private PostgresKeyValueStore store;

    @BeforeEach
    void setUp() throws SQLException {
        lenient().when(dataSource.getConnection()).thenReturn(connection);
        lenient().when(connection.prepareStatement(anyString())).thenReturn(statement);
        store = new PostgresKeyValueStore(dataSource);
    }

    @Test
    void testGetReturnsStoredValue() throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString("value")).thenReturn("cooldown");

        assertEquals(Optional.of("cooldown"), store.get("pairing_state"));
        verify(statement).setString(1, "pairing_state");
        verify(connection).close();
    }

    @Test
    void testGetMissingKeyIsEmpty() throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        assertTrue(store.get("pairing_state").isEmpty());
    }

    @Test
    void testSetUpserts() throws SQLException {
        store.set("consecutive_failures", "2");

        verify(connection).prepareStatement(contains("ON CONFLICT (key) DO UPDATE"));
        verify(statement).setString(1, "consecutive_failures");
        verify(statement).setString(2, "2");
        verify(statement).executeUpdate();
    }

    @Test
    void testDeleteRemovesKey() throws SQLException {
        store.delete("last_pairing_request_time");

        verify(connection).prepareStatement(contains("DELETE FROM health_monitor_state"));
        verify(statement).setString(1, "last_pairing_request_time");
        verify(statement).executeUpdate();
    }

    @Test
    void testSqlFailureIsWrapped() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        StateStoreException e = assertThrows(StateStoreException.class, () -> store.set("pairing_state", "idle"));
        assertInstanceOf(SQLException.class, e.getCause());
    }
}
