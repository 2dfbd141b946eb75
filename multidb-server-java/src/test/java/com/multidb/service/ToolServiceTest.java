package com.multidb.service;

import com.multidb.model.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolServiceTest {

    @Mock
    private QueryService queryService;
    @Mock
    private CrossSourceOrchestrator crossSourceOrchestrator;
    @Mock
    private UnifiedSearchService unifiedSearchService;
    @Mock
    private AggregateStatsService aggregateStatsService;

    private ToolService toolService;

    @BeforeEach
    void setUp() {
        toolService = new ToolService(queryService, crossSourceOrchestrator, unifiedSearchService,
            aggregateStatsService, TestSources.registry());
    }

    @Test
    void queryToolDelegatesTheQuestion() {
        Map<String, Object> answer = Map.of("success", true);
        when(queryService.handleNaturalQuery("show albums")).thenReturn(answer);

        assertThat(toolService.invoke("query", Map.of("question", "show albums"))).isSameAs(answer);
    }

    @Test
    void missingRequiredArgumentIsAnErrorResult() {
        assertThat(toolService.invoke("query", Map.of()))
            .containsExactly(Map.entry("error", "Missing required argument: question"));
        assertThat(toolService.invoke("sql", Map.of("database", "chinook")))
            .containsEntry("error", "Missing required argument: query");
        assertThat(toolService.invoke("aggregate_stats", null))
            .containsEntry("error", "Missing required argument: metric");
        verifyNoInteractions(queryService, aggregateStatsService);
    }

    @Test
    void unknownToolIsAnErrorResult() {
        assertThat(toolService.invoke("drop_everything", Map.of()))
            .containsEntry("error", "Unknown tool: drop_everything");
    }

    @Test
    void crossQueryAcceptsListOrSingleName() {
        when(crossSourceOrchestrator.combine(anyString(), any())).thenReturn(Map.of());

        toolService.invoke("cross_database_query", Map.of("query_description", "compare", "databases", List.of("chinook", "sakila")));
        verify(crossSourceOrchestrator).combine("compare", List.of("chinook", "sakila"));

        toolService.invoke("cross_database_query", Map.of("query_description", "revenue", "databases", "sakila"));
        verify(crossSourceOrchestrator).combine("revenue", List.of("sakila"));
    }

    @Test
    void optionalArgumentsMayBeAbsent() {
        Map<String, Object> args = new HashMap<>();
        args.put("search_term", "john");
        when(unifiedSearchService.search("john", null)).thenReturn(Map.of("total_matches", 0));
        when(queryService.getSchemaInfo("chinook", null)).thenReturn(Map.of("table_count", 11));

        assertThat(toolService.invoke("unified_search", args)).containsEntry("total_matches", 0);
        assertThat(toolService.invoke("schema", Map.of("database", "chinook"))).containsEntry("table_count", 11);
    }

    @Test
    void unexpectedExceptionBecomesAnErrorResult() {
        when(aggregateStatsService.aggregate("customers")).thenThrow(new IllegalStateException("pool exhausted"));

        assertThat(toolService.invoke("aggregate_stats", Map.of("metric", "customers")))
            .containsEntry("error", "pool exhausted");
    }

    @Test
    @SuppressWarnings("unchecked")
    void everyToolIsAdvertisedWithItsSchema() {
        List<ToolDefinition> tools = toolService.listTools();

        assertThat(tools).extracting(ToolDefinition::getName).containsExactly(
            "query", "cross_database_query", "sql", "schema", "databases", "unified_search", "aggregate_stats");

        assertThat(tools.get(0).getInputSchema()).containsEntry("required", List.of("question"));
        Map<String, Object> sqlSchema = tools.get(2).getInputSchema();
        assertThat(sqlSchema).containsEntry("type", "object").containsEntry("required", List.of("database", "query"));
        Map<String, Object> properties = (Map<String, Object>) sqlSchema.get("properties");
        assertThat((Map<String, Object>) properties.get("database"))
            .containsEntry("enum", List.of("school_erp", "chinook", "sakila"));
        assertThat(tools.get(4).getInputSchema()).doesNotContainKey("required");
    }
}
