package com.multidb.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class SourceSummary {
    private final String database;

    @JsonProperty("records_found")
    private final int recordsFound;

    private final String description;
}
