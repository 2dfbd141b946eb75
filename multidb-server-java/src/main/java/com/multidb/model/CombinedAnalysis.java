package com.multidb.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric merge of result sets coming from sources with different column sets.
 */
@Data
public class CombinedAnalysis {
    private final List<SourceSummary> summary = new ArrayList<>();
    private final Map<String, Double> totals = new LinkedHashMap<>();

    public void addSummary(SourceSummary sourceSummary) {
        summary.add(sourceSummary);
    }

    public void accumulate(String column, double value) {
        totals.merge(column, value, Double::sum);
    }

    public void registerColumn(String column) {
        totals.putIfAbsent(column, 0.0);
    }
}
