package com.multidb.service;

import com.multidb.config.MultiDbProperties;
import com.multidb.model.SqlExecutionResult;
import com.multidb.model.SqlExecutionResult.FailureType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.multidb.service.TestSources.CHINOOK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DatabaseManagerTest {

    private JdbcTemplate jdbcTemplate;
    private final List<String> connected = new ArrayList<>();
    private DatabaseManager databaseManager;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        databaseManager = new DatabaseManager(TestSources.registry()) {
            @Override
            protected JdbcTemplate createTemplate(MultiDbProperties.Source settings) {
                connected.add(settings.getName());
                return jdbcTemplate;
            }
        };
    }

    @Test
    void readStatementsReturnRows() {
        List<Map<String, Object>> rows = List.of(Map.of("Name", "AC/DC"));
        when(jdbcTemplate.queryForList("SELECT Name FROM artist", new Object[0])).thenReturn(rows);

        SqlExecutionResult result = databaseManager.executeQuery(CHINOOK, "  SELECT Name FROM artist \n");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isEqualTo(rows);
        assertThat(result.getRowCount()).isEqualTo(1);
        assertThat(result.getRowsAffected()).isNull();
    }

    @Test
    void writeStatementsReportAffectedRows() {
        when(jdbcTemplate.update("UPDATE artist SET Name = 'x' WHERE ArtistId = 1", new Object[0])).thenReturn(1);

        SqlExecutionResult result = databaseManager.executeQuery(CHINOOK, "UPDATE artist SET Name = 'x' WHERE ArtistId = 1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRowsAffected()).isEqualTo(1);
        assertThat(result.getData()).isNull();
    }

    @Test
    void unknownSourceFailsAsConnectionFailure() {
        SqlExecutionResult result = databaseManager.executeQuery("warehouse", "SELECT 1");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureType()).isEqualTo(FailureType.CONNECTION);
        assertThat(result.getError()).isEqualTo("Database connection failed for warehouse");
        assertThat(connected).isEmpty();
    }

    @Test
    void unreachableServerIsConnectionFailure() {
        when(jdbcTemplate.queryForList("SELECT 1", new Object[0]))
            .thenThrow(new CannotGetJdbcConnectionException("Could not connect to localhost:3306"));

        SqlExecutionResult result = databaseManager.executeQuery(CHINOOK, "SELECT 1");

        assertThat(result.getFailureType()).isEqualTo(FailureType.CONNECTION);
        assertThat(result.getError()).contains("localhost:3306");
        assertThat(databaseManager.isReachable(CHINOOK)).isFalse();
    }

    @Test
    void connectionFailureReportsTheDriverReason() {
        when(jdbcTemplate.queryForList("SELECT 1", new Object[0]))
            .thenThrow(new CannotGetJdbcConnectionException("Failed to obtain JDBC Connection",
                new SQLException("Connection refused")));

        SqlExecutionResult result = databaseManager.executeQuery(CHINOOK, "SELECT 1");

        assertThat(result.getFailureType()).isEqualTo(FailureType.CONNECTION);
        assertThat(result.getError()).isEqualTo("Connection refused");
    }

    @Test
    void badStatementIsExecutionFailure() {
        when(jdbcTemplate.queryForList("SELECT * FROM nope", new Object[0]))
            .thenThrow(new BadSqlGrammarException("query", "SELECT * FROM nope",
                new SQLException("Table 'chinook.nope' doesn't exist")));

        SqlExecutionResult result = databaseManager.executeQuery(CHINOOK, "SELECT * FROM nope");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureType()).isEqualTo(FailureType.EXECUTION);
        assertThat(result.getError()).isEqualTo("Table 'chinook.nope' doesn't exist");
    }

    @Test
    void templatesAreCreatedOncePerSource() {
        when(jdbcTemplate.queryForList("SELECT 1", new Object[0])).thenReturn(List.of(Map.of("1", 1)));

        assertThat(databaseManager.isReachable(CHINOOK)).isTrue();
        assertThat(databaseManager.isReachable(CHINOOK)).isTrue();
        assertThat(connected).containsExactly(CHINOOK);
    }

    @Test
    void boundParametersReachTheDriver() {
        when(jdbcTemplate.queryForList("SELECT Name FROM artist WHERE Name LIKE ?", "%ac%"))
            .thenReturn(List.of(Map.of("Name", "AC/DC")));

        SqlExecutionResult result = databaseManager.executeQuery(CHINOOK, "SELECT Name FROM artist WHERE Name LIKE ?", "%ac%");

        assertThat(result.getRowCount()).isEqualTo(1);
    }
}
