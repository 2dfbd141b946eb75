package com.multidb.service;

import com.multidb.config.MultiDbProperties;
import com.multidb.model.SqlExecutionResult;
import com.multidb.model.SqlExecutionResult.FailureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Runs statements against a named source. Never throws: every failure comes back as data.
 */
@Service
public class DatabaseManager {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    private static final Pattern READ_STATEMENT =
        Pattern.compile("^(SELECT|SHOW|DESCRIBE|DESC|WITH|EXPLAIN)\\b", Pattern.CASE_INSENSITIVE);

    private final SourceRegistry sourceRegistry;
    private final Map<String, JdbcTemplate> templates = new ConcurrentHashMap<>();

    public DatabaseManager(SourceRegistry sourceRegistry) {
        this.sourceRegistry = sourceRegistry;
    }

    public SqlExecutionResult executeQuery(String source, String sql, Object... args) {
        try {
            Optional<JdbcTemplate> template = getTemplate(source);
            if (template.isEmpty()) {
                return SqlExecutionResult.failure(FailureType.CONNECTION, "Database connection failed for " + source);
            }
            String statement = sql.trim();
            logger.info("Executing SQL on {}: {}", source, statement);
            if (READ_STATEMENT.matcher(statement).find()) {
                List<Map<String, Object>> data = template.get().queryForList(statement, args);
                return SqlExecutionResult.rows(data);
            } else {
                int rowCount = template.get().update(statement, args);
                return SqlExecutionResult.affected(rowCount);
            }
        } catch (DataAccessResourceFailureException e) {
            logger.error("Database connection failed for {}: {}", source, e.getMessage(), e);
            return SqlExecutionResult.failure(FailureType.CONNECTION, e.getMostSpecificCause().getMessage());
        } catch (DataAccessException e) {
            logger.error("Query execution error on {}: {}", source, e.getMessage(), e);
            return SqlExecutionResult.failure(FailureType.EXECUTION, e.getMostSpecificCause().getMessage());
        } catch (Exception e) {
            logger.error("Query execution error on {}: {}", source, e.getMessage(), e);
            return SqlExecutionResult.failure(FailureType.EXECUTION, e.getMessage());
        }
    }

    /**
     * Cheap round trip used by the health endpoint.
     */
    public boolean isReachable(String source) {
        return executeQuery(source, "SELECT 1").isSuccess();
    }

    private Optional<JdbcTemplate> getTemplate(String source) {
        Optional<MultiDbProperties.Source> settings = sourceRegistry.getConnectionSettings(source);
        if (settings.isEmpty()) {
            logger.warn("Unknown database requested: {}", source);
            return Optional.empty();
        }
        return Optional.of(templates.computeIfAbsent(source, name -> createTemplate(settings.get())));
    }

    protected JdbcTemplate createTemplate(MultiDbProperties.Source settings) {
        logger.info("Connecting to database {}...", settings.getName());
        String url = String.format("jdbc:mariadb://%s:%d/%s?useUnicode=true&characterEncoding=%s&useSSL=false&serverTimezone=UTC",
            settings.getHost(), settings.getPort(), settings.getDatabase(), settings.getCharset());

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setUrl(url);
        dataSource.setUsername(settings.getUsername());
        dataSource.setPassword(settings.getPassword());
        dataSource.setDriverClassName("org.mariadb.jdbc.Driver");

        return new JdbcTemplate(dataSource);
    }
}
