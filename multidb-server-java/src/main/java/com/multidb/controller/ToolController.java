package com.multidb.controller;

import com.multidb.model.QueryRequest;
import com.multidb.model.ToolDefinition;
import com.multidb.service.DatabaseManager;
import com.multidb.service.SchemaCache;
import com.multidb.service.SourceRegistry;
import com.multidb.service.ToolService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ToolController {
    private static final Logger logger = LoggerFactory.getLogger(ToolController.class);

    private final ToolService toolService;
    private final SourceRegistry sourceRegistry;
    private final DatabaseManager databaseManager;
    private final SchemaCache schemaCache;

    public ToolController(ToolService toolService, SourceRegistry sourceRegistry,
                          DatabaseManager databaseManager, SchemaCache schemaCache) {
        this.toolService = toolService;
        this.sourceRegistry = sourceRegistry;
        this.databaseManager = databaseManager;
        this.schemaCache = schemaCache;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
            "message", "Multi-Database Query API Server",
            "version", "1.0.0",
            "status", "running",
            "databases", sourceRegistry.getSourceNames()
        ));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> databases = new LinkedHashMap<>();
        boolean allConnected = true;
        for (String source : sourceRegistry.getSourceNames()) {
            boolean reachable = databaseManager.isReachable(source);
            allConnected &= reachable;
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("status", reachable ? "connected" : "unreachable");
            if (reachable) {
                status.put("tables_count", schemaCache.getTables(source).size());
            }
            databases.put(source, status);
        }
        if (!allConnected) {
            logger.warn("Health check: some databases are unreachable: {}", databases);
        }
        return ResponseEntity.status(allConnected ? 200 : 503).body(Map.of(
            "status", allConnected ? "healthy" : "degraded",
            "databases", databases
        ));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDefinition>> listTools() {
        return ResponseEntity.ok(toolService.listTools());
    }

    @PostMapping("/tools/{name}")
    public ResponseEntity<Map<String, Object>> callTool(@PathVariable String name,
                                                        @RequestBody(required = false) Map<String, Object> arguments) {
        return ResponseEntity.ok(toolService.invoke(name, arguments));
    }

    @PostMapping("/query")
    public ResponseEntity<Map<String, Object>> query(@Valid @RequestBody QueryRequest request) {
        logger.info("Incoming question: {}", request.getQuestion());
        return ResponseEntity.ok(toolService.invoke("query", Map.of("question", request.getQuestion())));
    }
}
