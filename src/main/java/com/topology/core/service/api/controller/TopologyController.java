package com.topology.core.service.api.controller;

import com.topology.core.service.api.dto.ApiResponse;
import com.topology.core.service.api.dto.SnapshotResponse;
import com.topology.core.service.api.dto.SnapshotResponse.DeviceResponse;
import com.topology.core.service.engine.GraphDiff;
import com.topology.core.service.engine.TopologyGraphStore;
import com.topology.core.service.model.Finding;
import com.topology.core.service.persistence.TopologyPersistence;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for topology snapshot queries.
 */
@Slf4j
@RestController
@RequestMapping("/topology")
@Tag(name = "Topology", description = "Endpoints for querying topology snapshots")
@RequiredArgsConstructor
public class TopologyController {

    private final TopologyGraphStore graphStore;
    private final TopologyPersistence persistence;

    // ==================== Endpoints ====================

    @GetMapping
    @Operation(summary = "Get current snapshot", description = "Returns the latest published topology snapshot")
    public ResponseEntity<ApiResponse<SnapshotResponse>> getCurrentSnapshot() {
        var snapshot = graphStore.current();
        log.debug("Returning snapshot v{}", snapshot.version());
        return ResponseEntity.ok(ApiResponse.success(SnapshotResponse.from(snapshot)));
    }

    @GetMapping("/versions/{version}")
    @Operation(summary = "Get snapshot by version", description = "Returns a snapshot still held in the history")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Snapshot found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Version unknown or evicted")
    })
    public ResponseEntity<ApiResponse<SnapshotResponse>> getSnapshot(
            @Parameter(description = "Snapshot version") @PathVariable long version) {
        return graphStore.findVersion(version)
                .map(snapshot -> ResponseEntity.ok(ApiResponse.success(SnapshotResponse.from(snapshot))))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.notFound("Snapshot version " + version)));
    }

    @GetMapping("/diff")
    @Operation(summary = "Diff two versions",
               description = "Devices and links added, removed or changed between two retained versions")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Diff computed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Version unknown or evicted")
    })
    public ResponseEntity<ApiResponse<GraphDiff>> diff(
            @Parameter(description = "Older version") @RequestParam long from,
            @Parameter(description = "Newer version") @RequestParam long to) {
        return ResponseEntity.ok(ApiResponse.success(graphStore.diff(from, to)));
    }

    @GetMapping("/devices/{identityKey}")
    @Operation(summary = "Get device", description = "Returns one device of the current snapshot")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Device found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Device not found")
    })
    public ResponseEntity<ApiResponse<DeviceResponse>> getDevice(
            @Parameter(description = "Identity key, e.g. mac:aa:bb:cc:dd:ee:ff") @PathVariable String identityKey) {
        return graphStore.current().findDevice(identityKey)
                .map(device -> ResponseEntity.ok(ApiResponse.success(DeviceResponse.from(device))))
                .orElseGet(() -> {
                    log.debug("Device not found: {}", identityKey);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound("Device"));
                });
    }

    @GetMapping("/findings")
    @Operation(summary = "List findings", description = "Findings recorded so far, newest first")
    public ResponseEntity<ApiResponse<List<Finding>>> getFindings(
            @Parameter(description = "Maximum number of findings") @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(ApiResponse.success(persistence.findings(limit)));
    }
}
