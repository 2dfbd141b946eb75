package com.multidb.model;

import java.util.Locale;
import java.util.Optional;

public enum SearchType {
    NAME,
    EMAIL,
    ID,
    TITLE,
    ALL;

    public static Optional<SearchType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(ALL);
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
