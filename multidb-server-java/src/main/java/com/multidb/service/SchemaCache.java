package com.multidb.service;

import com.multidb.model.ColumnDescription;
import com.multidb.model.SqlExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Per-source table listings, fetched on first use and kept for the life of the process.
 * Failed listings are not cached. Two threads racing on a cold source may both fetch;
 * the first stored listing wins.
 */
@Service
public class SchemaCache {
    private static final Logger logger = LoggerFactory.getLogger(SchemaCache.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_$]+");

    private final DatabaseManager databaseManager;
    private final Map<String, List<String>> tablesBySource = new ConcurrentHashMap<>();

    public SchemaCache(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    public List<String> getTables(String source) {
        List<String> cached = tablesBySource.get(source);
        if (cached != null) {
            return cached;
        }

        SqlExecutionResult result = databaseManager.executeQuery(source, "SHOW TABLES");
        if (!result.isSuccess()) {
            logger.error("Error fetching tables from {}: {}", source, result.getError());
            return List.of();
        }

        List<String> tables = result.getData().stream()
            .filter(row -> !row.isEmpty())
            .map(row -> String.valueOf(row.values().iterator().next()).toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableList());
        List<String> previous = tablesBySource.putIfAbsent(source, tables);
        return previous != null ? previous : tables;
    }

    /**
     * Column names and types of one table. Not cached; empty when the table cannot be described.
     */
    public List<ColumnDescription> getColumns(String source, String table) {
        if (!isValidTableName(table)) {
            logger.warn("Refusing to describe suspicious table name '{}' on {}", table, source);
            return List.of();
        }
        SqlExecutionResult result = databaseManager.executeQuery(source, "DESCRIBE `" + table + "`");
        if (!result.isSuccess()) {
            logger.error("Error describing {}.{}: {}", source, table, result.getError());
            return List.of();
        }
        return result.getData().stream()
            .map(row -> new ColumnDescription(asText(row.get("Field")), asText(row.get("Type"))))
            .collect(Collectors.toList());
    }

    public boolean isKnownTable(String source, String table) {
        return table != null && getTables(source).contains(table.toLowerCase(Locale.ROOT));
    }

    public static boolean isValidTableName(String table) {
        return table != null && TABLE_NAME.matcher(table).matches();
    }

    private static String asText(Object value) {
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return value == null ? "" : value.toString();
    }
}
