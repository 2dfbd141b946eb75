package com.multidb.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Routing decision for one question. Exactly one of resolved, ambiguous or unresolved.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassificationResult {

    public enum Status {
        RESOLVED,
        AMBIGUOUS,
        UNRESOLVED
    }

    public static final double TIE_CONFIDENCE = 50.0;

    private final Status status;
    private final String database;
    private final double confidence;
    private final String reasoning;
    private final String suggestion;
    private final List<String> matched;

    @JsonProperty("tied_databases")
    private final List<String> tiedDatabases;

    private final Map<String, Integer> scores;

    @JsonProperty("all_matches")
    private final Map<String, List<String>> allMatches;

    public static ClassificationResult resolved(String database, double confidence, String reasoning,
                                                List<String> matched, Map<String, Integer> scores,
                                                Map<String, List<String>> allMatches) {
        return new ClassificationResult(Status.RESOLVED, database, confidence, reasoning, null,
            List.copyOf(matched), null, scores, allMatches);
    }

    public static ClassificationResult ambiguous(List<String> tied, String reasoning, String suggestion,
                                                 Map<String, Integer> scores) {
        return new ClassificationResult(Status.AMBIGUOUS, null, TIE_CONFIDENCE, reasoning, suggestion,
            null, List.copyOf(tied), scores, null);
    }

    public static ClassificationResult unresolved(String reasoning, String suggestion, Map<String, Integer> scores) {
        return new ClassificationResult(Status.UNRESOLVED, null, 0.0, reasoning, suggestion,
            null, null, scores, null);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
