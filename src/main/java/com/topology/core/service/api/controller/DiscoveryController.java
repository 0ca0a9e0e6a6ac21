package com.topology.core.service.api.controller;

import com.topology.core.service.api.dto.ApiResponse;
import com.topology.core.service.api.dto.InventoryRoundRequest;
import com.topology.core.service.api.dto.RoundConfigRequest;
import com.topology.core.service.api.dto.RoundDetailResponse;
import com.topology.core.service.api.dto.RoundSummaryResponse;
import com.topology.core.service.api.dto.RunRoundRequest;
import com.topology.core.service.audit.DiscoveryAuditTrail;
import com.topology.core.service.config.DiscoveryConfig;
import com.topology.core.service.discovery.DiscoveryService;
import com.topology.core.service.discovery.RoundConfig;
import com.topology.core.service.discovery.TargetInventory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for discovery rounds.
 *
 * Rounds are queued and run in the background; the round id returned on
 * submission is used to poll the per-pair report.
 */
@Slf4j
@RestController
@RequestMapping("/discovery/rounds")
@Tag(name = "Discovery", description = "Endpoints for running and inspecting discovery rounds")
@RequiredArgsConstructor
public class DiscoveryController {

    private final DiscoveryService discoveryService;
    private final DiscoveryAuditTrail auditTrail;
    private final TargetInventory inventory;
    private final DiscoveryConfig discoveryConfig;

    // ==================== Endpoints ====================

    @PostMapping
    @Operation(
            summary = "Run a discovery round",
            description = "Queues a round that runs the selected probes against the given targets"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Round accepted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Round queue full")
    })
    public ResponseEntity<ApiResponse<RoundSubmission>> runRound(@Valid @RequestBody RunRoundRequest request) {
        var targets = request.getTargets().stream()
                .map(target -> inventory.target(target.getHost(), target.getInterfaceName(), target.getMac(),
                        target.getCredentialsRef(), target.getProbes()))
                .toList();
        var probes = TargetInventory.parseKinds(request.getProbes());

        var roundId = discoveryService.submitTargeted(targets, probes, roundConfig(request.getConfig()));
        log.info("Discovery round accepted: {} ({} targets)", roundId, targets.size());
        return accepted(roundId);
    }

    @PostMapping("/inventory")
    @Operation(
            summary = "Run an inventory round",
            description = "Queues a round over every configured inventory target"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Round accepted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "No inventory or invalid probes"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Round queue full")
    })
    public ResponseEntity<ApiResponse<RoundSubmission>> runInventoryRound(
            @Valid @RequestBody(required = false) InventoryRoundRequest request) {
        var body = request != null ? request : new InventoryRoundRequest();
        var roundId = discoveryService.submitInventory(TargetInventory.parseKinds(body.getProbes()),
                roundConfig(body.getConfig()), DiscoveryService.TRIGGER_INVENTORY);
        log.info("Inventory round accepted: {}", roundId);
        return accepted(roundId);
    }

    @GetMapping("/{roundId}")
    @Operation(summary = "Get round report", description = "Returns the per-pair status report of a round")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Round found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Round not found or expired")
    })
    public ResponseEntity<ApiResponse<RoundDetailResponse>> getRound(
            @Parameter(description = "Round ID") @PathVariable String roundId,
            @Parameter(description = "Include raw discovery records")
            @RequestParam(defaultValue = "false") boolean includeRecords) {
        return auditTrail.find(roundId)
                .map(audit -> ResponseEntity.ok(ApiResponse.success(RoundDetailResponse.from(audit, includeRecords))))
                .orElseGet(() -> {
                    log.debug("Round not found: {}", roundId);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound("Round"));
                });
    }

    @GetMapping
    @Operation(summary = "List recent rounds", description = "Returns summaries of the most recent rounds")
    public ResponseEntity<ApiResponse<List<RoundSummaryResponse>>> listRounds(
            @Parameter(description = "Maximum number of rounds") @RequestParam(defaultValue = "20") int limit) {
        var summaries = auditTrail.recent(limit).stream()
                .map(RoundSummaryResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(summaries));
    }

    // ==================== Helper Methods ====================

    private RoundConfig roundConfig(RoundConfigRequest overrides) {
        var defaults = RoundConfig.from(discoveryConfig.getRound());
        return overrides == null ? defaults : overrides.applyTo(defaults);
    }

    private ResponseEntity<ApiResponse<RoundSubmission>> accepted(String roundId) {
        return ResponseEntity.accepted()
                .body(ApiResponse.success(new RoundSubmission(roundId, "/discovery/rounds/" + roundId)));
    }

    /**
     * Response for an accepted round.
     */
    record RoundSubmission(
            String roundId,
            String statusUrl
    ) {}
}
