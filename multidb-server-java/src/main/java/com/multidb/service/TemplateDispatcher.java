package com.multidb.service;

import com.multidb.model.QueryTemplate;
import com.multidb.service.catalog.SourceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a question to one canned statement of the source's catalog. The question text is only
 * matched against guards; it never ends up inside the statement.
 */
@Service
public class TemplateDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(TemplateDispatcher.class);

    static final String UNKNOWN_SOURCE_STATEMENT = "SELECT 'Unknown database' as error";

    private final Map<String, SourceCatalog> catalogs = new LinkedHashMap<>();

    public TemplateDispatcher(List<SourceCatalog> catalogs) {
        for (SourceCatalog catalog : catalogs) {
            this.catalogs.put(catalog.sourceName(), catalog);
        }
        logger.info("Statement catalogs loaded for: {}", this.catalogs.keySet());
    }

    public String buildStatement(String source, String question) {
        return getCatalog(source)
            .map(catalog -> firstMatch(catalog.queryTemplates(), question).orElse(catalog.helpStatement()))
            .orElse(UNKNOWN_SOURCE_STATEMENT)
            .strip();
    }

    public String buildCrossSourceStatement(String source, String description) {
        return getCatalog(source)
            .map(catalog -> firstMatch(catalog.crossSourceTemplates(), description).orElse(catalog.crossSourceDefault()))
            .orElse(UNKNOWN_SOURCE_STATEMENT)
            .strip();
    }

    public Optional<SourceCatalog> getCatalog(String source) {
        return Optional.ofNullable(source).map(catalogs::get);
    }

    private static Optional<String> firstMatch(List<QueryTemplate> templates, String text) {
        String lowered = text == null ? "" : text.toLowerCase(Locale.ROOT);
        return templates.stream()
            .filter(template -> template.matches(lowered))
            .map(QueryTemplate::getStatement)
            .findFirst();
    }
}
