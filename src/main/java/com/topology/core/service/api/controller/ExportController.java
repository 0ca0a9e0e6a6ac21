package com.topology.core.service.api.controller;

import com.topology.core.service.api.dto.ApiResponse;
import com.topology.core.service.engine.TopologyGraphStore;
import com.topology.core.service.persistence.Neo4jWriter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for topology export operations.
 *
 * Handles GET /export/neo4j for Neo4j exports of the current snapshot.
 */
@Slf4j
@RestController
@RequestMapping("/export")
@Tag(name = "Topology Export", description = "Endpoints for exporting the topology to external systems")
@RequiredArgsConstructor
public class ExportController {

    private final TopologyGraphStore graphStore;
    private final Neo4jWriter neo4jWriter;

    /**
     * Exports the current snapshot to Neo4j.
     *
     * @param mode "cypher" to return Cypher statements, "push" to push directly to Neo4j
     */
    @GetMapping("/neo4j")
    @Operation(
            summary = "Export topology to Neo4j",
            description = "Generates Cypher statements or pushes the current snapshot directly to Neo4j"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Cypher statements returned"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Push to Neo4j initiated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Neo4j not connected")
    })
    public ResponseEntity<ApiResponse<Object>> exportToNeo4j(
            @Parameter(description = "Export mode: 'cypher' or 'push'")
            @RequestParam(defaultValue = "cypher") String mode) {
        long version = graphStore.current().version();
        log.debug("Export request: version={}, mode={}", version, mode);

        if ("push".equalsIgnoreCase(mode)) {
            return handlePushMode(version);
        }
        if (!"cypher".equalsIgnoreCase(mode)) {
            throw new IllegalArgumentException("Unknown export mode: " + mode);
        }
        return handleCypherMode(version);
    }

    private ResponseEntity<ApiResponse<Object>> handleCypherMode(long version) {
        List<String> cypherStatements = neo4jWriter.generateCypher();
        log.info("Generated {} Cypher statements for snapshot v{}", cypherStatements.size(), version);
        return ResponseEntity.ok(ApiResponse.success(
                new CypherExportResponse(version, cypherStatements)
        ));
    }

    private ResponseEntity<ApiResponse<Object>> handlePushMode(long version) {
        if (!neo4jWriter.isConnected()) {
            log.warn("Neo4j not connected, cannot push snapshot v{}", version);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.error("Neo4j not connected", "NEO4J_UNAVAILABLE"));
        }

        neo4jWriter.pushToNeo4j()
                .thenAccept(result -> {
                    if (result.success()) {
                        log.info("Neo4j push completed: v{} (devices={}, links={})",
                                result.version(), result.devicesExported(), result.linksExported());
                    } else {
                        log.error("Neo4j push failed: v{} - {}", result.version(), result.errorMessage());
                    }
                });

        log.info("Neo4j push initiated for snapshot v{}", version);
        return ResponseEntity.accepted()
                .body(ApiResponse.success(
                        new PushExportResponse(version, "Export to Neo4j initiated")
                ));
    }

    /**
     * Response for Cypher export mode.
     */
    record CypherExportResponse(
            long version,
            List<String> cypherStatements
    ) {}

    /**
     * Response for push export mode.
     */
    record PushExportResponse(
            long version,
            String message
    ) {}
}
