package com.multidb.service.catalog;

import com.multidb.model.SearchType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the search side of a catalog from per-kind UNION fragments.
 */
public abstract class AbstractSourceCatalog implements SourceCatalog {

    protected static final int ROW_LIMIT = 50;

    private final Map<SearchType, List<String>> searchFragments = new EnumMap<>(SearchType.class);

    /**
     * Registers a lookup fragment (no LIMIT) for a search kind. Fragments of every kind
     * together form the broadest lookup.
     */
    protected void searchFragment(SearchType searchType, String fragment) {
        searchFragments.computeIfAbsent(searchType, key -> new ArrayList<>()).add(fragment.strip());
    }

    @Override
    public Optional<String> searchStatement(SearchType searchType) {
        List<String> fragments;
        if (searchType == SearchType.ID || searchType == SearchType.ALL) {
            fragments = new ArrayList<>();
            searchFragments.values().forEach(fragments::addAll);
        } else {
            fragments = searchFragments.getOrDefault(searchType, List.of());
        }
        if (fragments.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join("\nUNION ALL\n", fragments) + "\nLIMIT " + ROW_LIMIT);
    }

    protected static boolean has(String question, String term) {
        return question.contains(term);
    }

    protected static boolean hasAny(String question, String... terms) {
        for (String term : terms) {
            if (question.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
