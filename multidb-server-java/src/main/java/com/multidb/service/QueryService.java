package com.multidb.service;

import com.multidb.model.ClassificationResult;
import com.multidb.model.SqlExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single-source operations: routed natural-language questions, direct SQL and schema lookups.
 */
@Service
public class QueryService {
    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private static final String SHOW_TABLES = "SHOW TABLES";

    private final SourceRegistry sourceRegistry;
    private final RoutingClassifier routingClassifier;
    private final TemplateDispatcher templateDispatcher;
    private final DatabaseManager databaseManager;
    private final SchemaCache schemaCache;

    public QueryService(SourceRegistry sourceRegistry, RoutingClassifier routingClassifier,
                        TemplateDispatcher templateDispatcher, DatabaseManager databaseManager,
                        SchemaCache schemaCache) {
        this.sourceRegistry = sourceRegistry;
        this.routingClassifier = routingClassifier;
        this.templateDispatcher = templateDispatcher;
        this.databaseManager = databaseManager;
        this.schemaCache = schemaCache;
    }

    public Map<String, Object> handleNaturalQuery(String question) {
        logger.info("Processing natural query: {}", question);

        ClassificationResult detection = routingClassifier.classify(question);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("question", question);

        if (!detection.isResolved()) {
            response.put("success", false);
            response.put("error", detection.getReasoning());
            response.put("suggestion", detection.getSuggestion());
            response.put("scores", detection.getScores());
            if (detection.getTiedDatabases() != null) {
                response.put("tied_databases", detection.getTiedDatabases());
                response.put("confidence", detection.getConfidence());
            }
            response.put("action_required", "Please rephrase your question or specify the database");
            response.put("available_databases", availableDatabases());
            return response;
        }

        String detected = detection.getDatabase();
        logger.info("Agent selected database: {} with {}% confidence",
            detected, String.format(Locale.ROOT, "%.1f", detection.getConfidence()));

        String sql = templateDispatcher.buildStatement(detected, question);
        logger.info("Generated SQL: {}", sql);

        SqlExecutionResult result = databaseManager.executeQuery(detected, sql);
        response.put("detected_database", detected);
        response.put("confidence", detection.getConfidence());
        response.put("sql", sql);

        if (result.isSuccess()) {
            response.put("success", true);
            response.put("reasoning", detection.getReasoning());
            response.put("database_description", sourceRegistry.getDescription(detected));
            response.put("data", result.getData() != null ? result.getData() : List.of());
            response.put("row_count", result.getRowCount() != null ? result.getRowCount() : 0);
        } else {
            response.put("success", false);
            response.put("error", result.getError());
            response.put("failure_type", result.getFailureType());
            response.put("suggestion", "Try rephrasing your question or use the 'sql' tool for direct queries");
        }
        return response;
    }

    public Map<String, Object> executeSql(String database, String sql) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("database", database);
        if (!sourceRegistry.contains(database)) {
            response.put("error", "Unknown database: " + database);
            return response;
        }

        SqlExecutionResult result = databaseManager.executeQuery(database, sql);
        if (!result.isSuccess()) {
            response.put("error", result.getError());
            response.put("failure_type", result.getFailureType());
            response.put("sql", sql);
            return response;
        }

        response.put("success", true);
        if (result.getRowsAffected() != null) {
            response.put("rows_affected", result.getRowsAffected());
        } else {
            response.put("data", result.getData());
            response.put("row_count", result.getRowCount());
        }
        return response;
    }

    public Map<String, Object> getSchemaInfo(String database, String table) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("database", database);
        if (!sourceRegistry.contains(database)) {
            response.put("error", "Unknown database: " + database);
            return response;
        }

        if (table == null || table.isBlank()) {
            SqlExecutionResult listing = databaseManager.executeQuery(database, SHOW_TABLES);
            if (!listing.isSuccess()) {
                return failed(response, listing, SHOW_TABLES);
            }
            List<String> tables = listing.getData().stream()
                .filter(row -> !row.isEmpty())
                .map(row -> String.valueOf(row.values().iterator().next()))
                .collect(Collectors.toList());
            response.put("description", sourceRegistry.getDescription(database));
            response.put("tables", tables);
            response.put("table_count", tables.size());
            return response;
        }

        response.put("table", table);
        if (!SchemaCache.isValidTableName(table) || !schemaCache.isKnownTable(database, table)) {
            response.put("error", "Unknown table '" + table + "' in " + database);
            return response;
        }

        String describe = "DESCRIBE `" + table + "`";
        SqlExecutionResult columns = databaseManager.executeQuery(database, describe);
        if (!columns.isSuccess()) {
            return failed(response, columns, describe);
        }
        String countStatement = "SELECT COUNT(*) as count FROM `" + table + "`";
        SqlExecutionResult count = databaseManager.executeQuery(database, countStatement);
        if (!count.isSuccess()) {
            return failed(response, count, countStatement);
        }
        response.put("columns", columns.getData());
        response.put("row_count", count.firstValue());
        return response;
    }

    public Map<String, Object> listDatabases() {
        List<Map<String, Object>> databases = sourceRegistry.getProfiles().stream()
            .map(profile -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", profile.getName());
                entry.put("description", profile.getDescription());
                entry.put("host", profile.getHost());
                return entry;
            })
            .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("databases", databases);
        response.put("total", databases.size());
        return response;
    }

    private List<Map<String, String>> availableDatabases() {
        return sourceRegistry.getProfiles().stream()
            .map(profile -> {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("name", profile.getName());
                entry.put("description", profile.getDescription());
                return entry;
            })
            .collect(Collectors.toList());
    }

    private static Map<String, Object> failed(Map<String, Object> response, SqlExecutionResult result, String sql) {
        response.put("error", result.getError());
        response.put("failure_type", result.getFailureType());
        response.put("sql", sql);
        return response;
    }
}
