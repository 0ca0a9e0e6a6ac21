package com.topology.core.service.api.controller;

import com.topology.core.service.analytics.AnalysisReport;
import com.topology.core.service.api.dto.ApiResponse;
import com.topology.core.service.engine.TopologyCommitService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for structural analysis of the current snapshot.
 */
@Slf4j
@RestController
@Tag(name = "Analytics", description = "Graph metrics and vulnerability findings")
@RequiredArgsConstructor
public class AnalyticsController {

    private final TopologyCommitService commitService;

    @GetMapping("/topology/analysis")
    @Operation(summary = "Analyze current snapshot",
               description = "Degree, components, diameter, clustering, betweenness and vulnerability findings")
    public ResponseEntity<ApiResponse<AnalysisReport>> analyze() {
        var report = commitService.currentReport();
        log.debug("Analysis of v{}: {} findings", report.graphVersion(), report.findings().size());
        return ResponseEntity.ok(ApiResponse.success(report));
    }
}
