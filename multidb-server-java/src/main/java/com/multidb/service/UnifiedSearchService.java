package com.multidb.service;

import com.multidb.model.SearchStatement;
import com.multidb.model.SearchType;
import com.multidb.model.SqlExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks a term up in every source. The term is always bound as a statement parameter.
 * A source whose lookup fails is listed under {@code failures} and left out of the matches.
 */
@Service
public class UnifiedSearchService {
    private static final Logger logger = LoggerFactory.getLogger(UnifiedSearchService.class);

    private final SourceRegistry sourceRegistry;
    private final TemplateDispatcher templateDispatcher;
    private final DatabaseManager databaseManager;

    public UnifiedSearchService(SourceRegistry sourceRegistry, TemplateDispatcher templateDispatcher,
                                DatabaseManager databaseManager) {
        this.sourceRegistry = sourceRegistry;
        this.templateDispatcher = templateDispatcher;
        this.databaseManager = databaseManager;
    }

    public Map<String, Object> search(String searchTerm, String searchType) {
        logger.info("Unified search for '{}' (type: {})", searchTerm, searchType);

        Optional<SearchType> type = SearchType.parse(searchType);
        if (type.isEmpty()) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", "Unknown search_type: " + searchType + " (expected name, email, id, title or all)");
            error.put("search_term", searchTerm);
            return error;
        }

        Map<String, Map<String, Object>> results = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String source : sourceRegistry.getSourceNames()) {
            Optional<SearchStatement> statement = buildSearchStatement(source, searchTerm, type.get());
            if (statement.isEmpty()) {
                logger.debug("No {} lookup defined for {}", type.get().label(), source);
                continue;
            }

            SqlExecutionResult result = databaseManager.executeQuery(
                source, statement.get().getSql(), statement.get().parameterArray());
            if (!result.isSuccess()) {
                logger.warn("Search on {} failed: {}", source, result.getError());
                failures.put(source, result.getError());
                continue;
            }
            if (result.hasRows()) {
                Map<String, Object> hits = new LinkedHashMap<>();
                hits.put("matches", result.getData());
                hits.put("count", result.getRowCount());
                results.put(source, hits);
            }
        }

        int totalMatches = results.values().stream()
            .mapToInt(hits -> (Integer) hits.get("count"))
            .sum();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("search_term", searchTerm);
        response.put("search_type", type.get().label());
        response.put("total_matches", totalMatches);
        response.put("results_by_database", results);
        response.put("databases_searched", sourceRegistry.getSourceNames());
        response.put("failures", failures);
        return response;
    }

    public Optional<SearchStatement> buildSearchStatement(String source, String searchTerm, SearchType searchType) {
        return templateDispatcher.getCatalog(source)
            .flatMap(catalog -> catalog.searchStatement(searchType))
            .map(sql -> SearchStatement.like(sql, searchTerm == null ? "" : searchTerm));
    }
}
