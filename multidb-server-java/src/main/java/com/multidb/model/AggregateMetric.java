package com.multidb.model;

import java.util.Arrays;
import java.util.Optional;

public enum AggregateMetric {
    TOTAL_RECORDS("total_records"),
    CUSTOMERS("customers"),
    PAYMENTS("payments"),
    ENTITY_COUNTS("entity_counts");

    private final String key;

    AggregateMetric(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<AggregateMetric> fromKey(String key) {
        return Arrays.stream(values())
            .filter(metric -> metric.key.equals(key))
            .findFirst();
    }
}
