package com.multidb.service;

import com.multidb.model.AggregateMetric;
import com.multidb.model.SqlExecutionResult;
import com.multidb.service.catalog.SourceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed count/sum statistics per source. A statement that fails is left out of the numbers
 * and reported under {@code failures} instead.
 */
@Service
public class AggregateStatsService {
    private static final Logger logger = LoggerFactory.getLogger(AggregateStatsService.class);

    static final int TABLE_COUNT_LIMIT = 20;

    private final SourceRegistry sourceRegistry;
    private final SchemaCache schemaCache;
    private final TemplateDispatcher templateDispatcher;
    private final DatabaseManager databaseManager;

    public AggregateStatsService(SourceRegistry sourceRegistry, SchemaCache schemaCache,
                                 TemplateDispatcher templateDispatcher, DatabaseManager databaseManager) {
        this.sourceRegistry = sourceRegistry;
        this.schemaCache = schemaCache;
        this.templateDispatcher = templateDispatcher;
        this.databaseManager = databaseManager;
    }

    public Map<String, Object> aggregate(String metricKey) {
        logger.info("Calculating aggregate metric: {}", metricKey);

        Optional<AggregateMetric> metric = AggregateMetric.fromKey(metricKey);
        if (metric.isEmpty()) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("metric", metricKey);
            error.put("error", "Unknown metric: " + metricKey
                + " (expected total_records, customers, payments or entity_counts)");
            return error;
        }

        Map<String, Object> byDatabase = new LinkedHashMap<>();
        Map<String, Object> totals = new LinkedHashMap<>();
        Map<String, Map<String, String>> failures = new LinkedHashMap<>();

        for (String source : sourceRegistry.getSourceNames()) {
            Map<String, String> sourceFailures = new LinkedHashMap<>();
            AggregateMetric requested = metric.get();
            if (requested == AggregateMetric.TOTAL_RECORDS) {
                Map<String, Long> tableCounts = countTables(source, sourceFailures);
                byDatabase.put(source, tableCounts);
                totals.put(source, tableCounts.values().stream().mapToLong(Long::longValue).sum());
            } else if (requested == AggregateMetric.CUSTOMERS) {
                catalogFor(source, sourceFailures)
                    .map(catalog -> run(source, "customers", catalog.customerCountStatement(), sourceFailures))
                    .flatMap(result -> Optional.ofNullable(result.firstValue()))
                    .ifPresent(count -> byDatabase.put(source, count));
            } else if (requested == AggregateMetric.PAYMENTS) {
                catalogFor(source, sourceFailures)
                    .map(catalog -> run(source, "payments", catalog.paymentStatement(), sourceFailures))
                    .filter(SqlExecutionResult::hasRows)
                    .ifPresent(result -> byDatabase.put(source, result.getData().get(0)));
            } else {
                byDatabase.put(source, countEntities(source, sourceFailures));
            }
            if (!sourceFailures.isEmpty()) {
                failures.put(source, sourceFailures);
            }
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("metric", metric.get().getKey());
        stats.put("by_database", byDatabase);
        stats.put("totals", totals);
        stats.put("failures", failures);
        return stats;
    }

    private Map<String, Long> countTables(String source, Map<String, String> failures) {
        Map<String, Long> counts = new LinkedHashMap<>();
        List<String> tables = schemaCache.getTables(source);
        for (String table : tables.subList(0, Math.min(TABLE_COUNT_LIMIT, tables.size()))) {
            if (!SchemaCache.isValidTableName(table)) {
                failures.put(table, "unsupported table name");
                continue;
            }
            SqlExecutionResult result = run(source, table, "SELECT COUNT(*) as count FROM `" + table + "`", failures);
            Object count = result.firstValue();
            if (count instanceof Number) {
                counts.put(table, ((Number) count).longValue());
            }
        }
        return counts;
    }

    private Map<String, Object> countEntities(String source, Map<String, String> failures) {
        Map<String, Object> counts = new LinkedHashMap<>();
        catalogFor(source, failures).ifPresent(catalog -> {
            for (Map.Entry<String, String> entity : catalog.entityCountStatements().entrySet()) {
                SqlExecutionResult result = run(source, entity.getKey(), entity.getValue(), failures);
                Object count = result.firstValue();
                if (count != null) {
                    counts.put(entity.getKey(), count);
                }
            }
        });
        return counts;
    }

    private Optional<SourceCatalog> catalogFor(String source, Map<String, String> failures) {
        Optional<SourceCatalog> catalog = templateDispatcher.getCatalog(source);
        if (catalog.isEmpty()) {
            failures.put("*", "no statement catalog for " + source);
        }
        return catalog;
    }

    private SqlExecutionResult run(String source, String item, String sql, Map<String, String> failures) {
        SqlExecutionResult result = databaseManager.executeQuery(source, sql);
        if (!result.isSuccess()) {
            logger.warn("Skipping {} on {}: {}", item, source, result.getError());
            failures.put(item, result.getError());
        }
        return result;
    }
}
