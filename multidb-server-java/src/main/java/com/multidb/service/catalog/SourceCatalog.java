package com.multidb.service.catalog;

import com.multidb.model.QueryTemplate;
import com.multidb.model.SearchType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed statement catalog for one known schema. Everything here is static configuration:
 * guards are tried in list order and the first match wins.
 */
public interface SourceCatalog {

    /**
     * Name of the configured source this catalog answers for.
     */
    String sourceName();

    /**
     * Single-source question templates, highest priority first.
     */
    List<QueryTemplate> queryTemplates();

    /**
     * Returned when no question template matches.
     */
    String helpStatement();

    /**
     * Templates tuned for comparative phrasing across sources.
     */
    List<QueryTemplate> crossSourceTemplates();

    /**
     * Top entity counts, used when no cross-source template matches.
     */
    String crossSourceDefault();

    /**
     * Lookup statement for a search kind, with one {@code ?} per bound search term.
     * {@link SearchType#ID} and {@link SearchType#ALL} give the broadest lookup the schema supports.
     */
    Optional<String> searchStatement(SearchType searchType);

    String customerCountStatement();

    /**
     * One row with {@code count} and {@code total} columns.
     */
    String paymentStatement();

    /**
     * Entity label to a single-value count statement, in display order.
     */
    Map<String, String> entityCountStatements();
}
