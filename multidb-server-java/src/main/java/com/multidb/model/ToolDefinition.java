package com.multidb.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

@Data
public class ToolDefinition {
    private final String name;
    private final String description;

    @JsonProperty("input_schema")
    private final Map<String, Object> inputSchema;
}
