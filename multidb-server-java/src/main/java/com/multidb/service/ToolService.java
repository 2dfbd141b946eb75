package com.multidb.service;

import com.multidb.exception.ToolArgumentException;
import com.multidb.model.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named operations callable by an agent. Every call returns a map; failures show up as an
 * {@code error} entry rather than an exception.
 */
@Service
public class ToolService {
    private static final Logger logger = LoggerFactory.getLogger(ToolService.class);

    private final QueryService queryService;
    private final CrossSourceOrchestrator crossSourceOrchestrator;
    private final UnifiedSearchService unifiedSearchService;
    private final AggregateStatsService aggregateStatsService;
    private final SourceRegistry sourceRegistry;

    public ToolService(QueryService queryService, CrossSourceOrchestrator crossSourceOrchestrator,
                       UnifiedSearchService unifiedSearchService, AggregateStatsService aggregateStatsService,
                       SourceRegistry sourceRegistry) {
        this.queryService = queryService;
        this.crossSourceOrchestrator = crossSourceOrchestrator;
        this.unifiedSearchService = unifiedSearchService;
        this.aggregateStatsService = aggregateStatsService;
        this.sourceRegistry = sourceRegistry;
    }

    public Map<String, Object> invoke(String name, Map<String, Object> arguments) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        logger.info("Handling tool call: {} with arguments: {}", name, args);

        try {
            switch (name) {
                case "query":
                    return queryService.handleNaturalQuery(requireString(args, "question"));
                case "cross_database_query":
                    return crossSourceOrchestrator.combine(
                        requireString(args, "query_description"),
                        optionalStringList(args, "databases"));
                case "sql":
                    return queryService.executeSql(requireString(args, "database"), requireString(args, "query"));
                case "schema":
                    return queryService.getSchemaInfo(requireString(args, "database"), optionalString(args, "table"));
                case "databases":
                    return queryService.listDatabases();
                case "unified_search":
                    return unifiedSearchService.search(
                        requireString(args, "search_term"),
                        optionalString(args, "search_type"));
                case "aggregate_stats":
                    return aggregateStatsService.aggregate(requireString(args, "metric"));
                default:
                    return errorResult("Unknown tool: " + name);
            }
        } catch (ToolArgumentException e) {
            logger.warn("Invalid arguments for {}: {}", name, e.getMessage());
            return errorResult(e.getMessage());
        } catch (Exception e) {
            logger.error("Error in tool handler: {}", e.getMessage(), e);
            return errorResult(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public List<ToolDefinition> listTools() {
        List<String> sourceNames = sourceRegistry.getSourceNames();
        String sourceList = String.join("/", sourceNames);
        List<ToolDefinition> tools = new ArrayList<>();

        tools.add(new ToolDefinition("query",
            "Query any database using natural language. Routes to the matching database (" + sourceList + ").",
            schema(Map.of("question", property("string",
                "Natural language question about any data")), List.of("question"))));

        Map<String, Object> databases = property("array",
            "Databases to query (optional, auto-detected when omitted)");
        databases.put("items", Map.of("type", "string", "enum", sourceNames));
        tools.add(new ToolDefinition("cross_database_query",
            "Execute queries across multiple databases and combine results. Use for comparative analysis.",
            schema(orderedProperties(
                "query_description", property("string", "What to compare or analyze across databases"),
                "databases", databases), List.of("query_description"))));

        tools.add(new ToolDefinition("sql",
            "Execute direct SQL query on a specific database",
            schema(orderedProperties(
                "database", enumProperty("Database name", sourceNames),
                "query", property("string", "SQL query to execute")), List.of("database", "query"))));

        tools.add(new ToolDefinition("schema",
            "Get database schema information",
            schema(orderedProperties(
                "database", enumProperty("Database name", sourceNames),
                "table", property("string", "Table name (optional)")), List.of("database"))));

        tools.add(new ToolDefinition("databases",
            "List all available databases and their descriptions",
            schema(Map.of(), List.of())));

        tools.add(new ToolDefinition("unified_search",
            "Search for a term across all databases and return matching records from all sources",
            schema(orderedProperties(
                "search_term", property("string", "Term to search for across all databases"),
                "search_type", enumProperty("Type of search to perform",
                    List.of("name", "email", "id", "title", "all"))), List.of("search_term"))));

        tools.add(new ToolDefinition("aggregate_stats",
            "Get aggregate statistics across all databases",
            schema(Map.of("metric", enumProperty("Type of aggregate metric to calculate",
                List.of("total_records", "customers", "payments", "entity_counts"))), List.of("metric"))));

        return tools;
    }

    private static String requireString(Map<String, Object> args, String key) {
        String value = optionalString(args, key);
        if (value == null || value.isBlank()) {
            throw new ToolArgumentException("Missing required argument: " + key);
        }
        return value;
    }

    private static String optionalString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value == null ? null : value.toString();
    }

    private static List<String> optionalStringList(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Collection) {
            List<String> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(String.valueOf(item));
            }
            return items;
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        throw new ToolArgumentException("Argument '" + key + "' must be a list of database names");
    }

    private static Map<String, Object> errorResult(String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", message);
        return result;
    }

    private static Map<String, Object> schema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private static Map<String, Object> property(String type, String description) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", type);
        property.put("description", description);
        return property;
    }

    private static Map<String, Object> enumProperty(String description, List<String> values) {
        Map<String, Object> property = property("string", description);
        property.put("enum", values);
        return property;
    }

    private static Map<String, Object> orderedProperties(String firstKey, Object firstValue,
                                                         String secondKey, Object secondValue) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(firstKey, firstValue);
        properties.put(secondKey, secondValue);
        return properties;
    }
}
