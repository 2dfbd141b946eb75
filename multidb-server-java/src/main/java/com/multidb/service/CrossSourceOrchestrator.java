package com.multidb.service;

import com.multidb.model.CombinedAnalysis;
import com.multidb.model.SourceProfile;
import com.multidb.model.SourceSummary;
import com.multidb.model.SqlExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one comparative question against several sources in turn and merges the numbers.
 * A failing source is recorded next to the others; it never stops the run.
 */
@Service
public class CrossSourceOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(CrossSourceOrchestrator.class);

    static final List<String> BROAD_TERMS = List.of("all", "compare", "across", "every", "total");

    private final SourceRegistry sourceRegistry;
    private final TemplateDispatcher templateDispatcher;
    private final DatabaseManager databaseManager;

    public CrossSourceOrchestrator(SourceRegistry sourceRegistry, TemplateDispatcher templateDispatcher,
                                   DatabaseManager databaseManager) {
        this.sourceRegistry = sourceRegistry;
        this.templateDispatcher = templateDispatcher;
        this.databaseManager = databaseManager;
    }

    public Map<String, Object> combine(String description, List<String> explicitSources) {
        logger.info("Processing cross-database query: {}", description);

        List<String> databases = explicitSources != null
            ? List.copyOf(explicitSources)
            : detectRelevantSources(description);

        Map<String, Map<String, Object>> individualResults = new LinkedHashMap<>();
        Map<String, SqlExecutionResult> successes = new LinkedHashMap<>();
        for (String database : databases) {
            String sql = templateDispatcher.buildCrossSourceStatement(database, description);
            SqlExecutionResult result = databaseManager.executeQuery(database, sql);

            Map<String, Object> outcome = new LinkedHashMap<>();
            if (result.isSuccess()) {
                outcome.put("data", result.getData() != null ? result.getData() : List.of());
                outcome.put("row_count", result.getRowCount() != null ? result.getRowCount() : 0);
                successes.put(database, result);
            } else {
                logger.warn("Cross-database query failed on {}: {}", database, result.getError());
                outcome.put("error", result.getError());
            }
            outcome.put("sql", sql);
            individualResults.put(database, outcome);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("query_description", description);
        response.put("databases_queried", databases);
        response.put("individual_results", individualResults);
        response.put("combined_analysis", analyze(successes));
        return response;
    }

    /**
     * Broad wording selects every source; otherwise sources whose keywords appear;
     * when nothing appears, every source again.
     */
    public List<String> detectRelevantSources(String description) {
        String lowered = description == null ? "" : description.toLowerCase(Locale.ROOT);

        if (BROAD_TERMS.stream().anyMatch(lowered::contains)) {
            return sourceRegistry.getSourceNames();
        }

        List<String> relevant = new ArrayList<>();
        for (SourceProfile profile : sourceRegistry.getProfiles()) {
            if (profile.getKeywords().stream().anyMatch(lowered::contains)) {
                relevant.add(profile.getName());
            }
        }
        return relevant.isEmpty() ? sourceRegistry.getSourceNames() : relevant;
    }

    /**
     * Columns that are numeric in a source's first row are summed over all of that source's rows
     * and added into a total shared by every source exposing the same column name.
     */
    CombinedAnalysis analyze(Map<String, SqlExecutionResult> successes) {
        CombinedAnalysis analysis = new CombinedAnalysis();
        for (Map.Entry<String, SqlExecutionResult> entry : successes.entrySet()) {
            SqlExecutionResult result = entry.getValue();
            if (!result.hasRows()) {
                continue;
            }
            List<Map<String, Object>> rows = result.getData();
            for (Map.Entry<String, Object> field : rows.get(0).entrySet()) {
                if (!(field.getValue() instanceof Number)) {
                    continue;
                }
                String column = field.getKey();
                analysis.registerColumn(column);
                for (Map<String, Object> row : rows) {
                    Object value = row.get(column);
                    if (value instanceof Number) {
                        analysis.accumulate(column, ((Number) value).doubleValue());
                    }
                }
            }
            analysis.addSummary(new SourceSummary(entry.getKey(), rows.size(),
                sourceRegistry.getDescription(entry.getKey())));
        }
        return analysis;
    }
}
