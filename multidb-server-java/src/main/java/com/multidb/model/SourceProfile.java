package com.multidb.model;

import lombok.Data;

import java.util.List;

/**
 * A configured data source: its name, what it holds, and the words that point at it.
 */
@Data
public class SourceProfile {
    private final String name;
    private final String description;
    private final String host;
    private final List<String> keywords;

    public SourceProfile(String name, String description, String host, List<String> keywords) {
        this.name = name;
        this.description = description;
        this.host = host;
        this.keywords = List.copyOf(keywords);
    }

    public String describe() {
        return name + " (" + description + ")";
    }
}
