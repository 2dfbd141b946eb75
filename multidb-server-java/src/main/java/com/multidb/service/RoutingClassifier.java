package com.multidb.service;

import com.multidb.model.ClassificationResult;
import com.multidb.model.ColumnDescription;
import com.multidb.model.SourceProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decides which source a free-text question is about.
 *
 * <p>Scoring runs in phases, each only when everything scored so far is zero:
 * configured keywords, then table names (weight {@value #TABLE_MATCH_WEIGHT}),
 * then column names of the first {@value #COLUMN_SCAN_TABLE_LIMIT} tables of each source.
 * A single top score resolves; a shared top score is a tie; all zeros is unresolved.
 */
@Service
public class RoutingClassifier {
    private static final Logger logger = LoggerFactory.getLogger(RoutingClassifier.class);

    static final int TABLE_MATCH_WEIGHT = 5;
    static final int COLUMN_SCAN_TABLE_LIMIT = 10;
    static final int MIN_COLUMN_TOKEN_LENGTH = 3;
    static final int REASONING_MARKER_LIMIT = 5;

    private final SourceRegistry sourceRegistry;
    private final SchemaCache schemaCache;

    public RoutingClassifier(SourceRegistry sourceRegistry, SchemaCache schemaCache) {
        this.sourceRegistry = sourceRegistry;
        this.schemaCache = schemaCache;
    }

    public ClassificationResult classify(String question) {
        String questionLower = question == null ? "" : question.toLowerCase(Locale.ROOT);

        Map<String, Integer> scores = new LinkedHashMap<>();
        Map<String, List<String>> matched = new LinkedHashMap<>();
        for (String source : sourceRegistry.getSourceNames()) {
            scores.put(source, 0);
            matched.put(source, new ArrayList<>());
        }

        matchKeywords(questionLower, scores, matched);

        if (maxScore(scores) == 0) {
            logger.info("No keyword matches found. Attempting table name matching...");
            matchTableNames(questionLower, scores, matched);
        }

        if (maxScore(scores) == 0) {
            logger.info("No table matches found. Attempting column name matching...");
            matchColumnNames(questionLower, scores, matched);
        }

        return resolve(scores, matched);
    }

    /**
     * Asymptotic confidence: grows with the score, never reaches 100 for a finite score.
     */
    static double confidenceFor(int score) {
        return Math.min(100.0, 100.0 * score / (score + 1));
    }

    /**
     * Column name as used for matching: every "_id" and "_name" removed.
     */
    static String normalizeColumnName(String columnName) {
        return columnName.toLowerCase(Locale.ROOT).replace("_id", "").replace("_name", "");
    }

    private void matchKeywords(String question, Map<String, Integer> scores, Map<String, List<String>> matched) {
        for (SourceProfile profile : sourceRegistry.getProfiles()) {
            for (String keyword : profile.getKeywords()) {
                if (question.contains(keyword)) {
                    scores.merge(profile.getName(), 1, Integer::sum);
                    matched.get(profile.getName()).add(keyword);
                }
            }
        }
    }

    private void matchTableNames(String question, Map<String, Integer> scores, Map<String, List<String>> matched) {
        for (String source : scores.keySet()) {
            for (String table : schemaCache.getTables(source)) {
                if (question.contains(table)) {
                    scores.merge(source, TABLE_MATCH_WEIGHT, Integer::sum);
                    matched.get(source).add("table:" + table);
                    logger.info("Found table name '{}' in question for {}", table, source);
                }
            }
        }
    }

    private void matchColumnNames(String question, Map<String, Integer> scores, Map<String, List<String>> matched) {
        for (String source : scores.keySet()) {
            int columnScore = 0;
            List<String> tables = schemaCache.getTables(source);
            for (String table : tables.subList(0, Math.min(COLUMN_SCAN_TABLE_LIMIT, tables.size()))) {
                for (ColumnDescription column : schemaCache.getColumns(source, table)) {
                    String cleaned = normalizeColumnName(column.getName());
                    if (cleaned.length() > MIN_COLUMN_TOKEN_LENGTH && question.contains(cleaned)) {
                        columnScore++;
                        logger.info("Found column match '{}' in {}.{}", column.getName(), source, table);
                    }
                }
            }
            if (columnScore > 0) {
                scores.merge(source, columnScore, Integer::sum);
                matched.get(source).add("column_matches:" + columnScore);
            }
        }
    }

    private ClassificationResult resolve(Map<String, Integer> scores, Map<String, List<String>> matched) {
        int maxScore = maxScore(scores);
        Map<String, Integer> scoreView = Collections.unmodifiableMap(scores);

        if (maxScore == 0) {
            return ClassificationResult.unresolved(
                "Could not determine database from question",
                "Please specify or ask about: " + sourceRegistry.describe(sourceRegistry.getSourceNames()),
                scoreView);
        }

        List<String> top = scores.entrySet().stream()
            .filter(entry -> entry.getValue() == maxScore)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());

        if (top.size() > 1) {
            logger.info("Ambiguous question, tied sources: {}", top);
            return ClassificationResult.ambiguous(
                top,
                "Ambiguous query matches multiple databases: " + String.join(", ", top),
                "Please clarify if you want data from: " + sourceRegistry.describe(top),
                scoreView);
        }

        String detected = top.get(0);
        double confidence = confidenceFor(maxScore);
        List<String> markers = matched.get(detected);
        List<String> shown = markers.subList(0, Math.min(REASONING_MARKER_LIMIT, markers.size()));
        logger.info("Detected database: {} (score: {}, confidence: {}%)",
            detected, maxScore, String.format(Locale.ROOT, "%.1f", confidence));

        return ClassificationResult.resolved(
            detected,
            confidence,
            "Matched keywords/patterns: " + String.join(", ", shown),
            markers,
            scoreView,
            Collections.unmodifiableMap(matched));
    }

    private static int maxScore(Map<String, Integer> scores) {
        return scores.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
