package com.topology.core.service.api.controller;

import com.topology.core.service.api.dto.ApiResponse;
import com.topology.core.service.events.ChangeEventHub;
import com.topology.core.service.events.TopologyChangeEvent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * Controller for topology change events.
 */
@RestController
@RequestMapping("/topology/events")
@Tag(name = "Change Events", description = "Server-sent topology change events")
@RequiredArgsConstructor
public class EventStreamController {

    private final ChangeEventHub eventHub;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Subscribe to changes", description = "Streams one event per device, link or finding change")
    public SseEmitter stream() {
        return eventHub.subscribe();
    }

    @GetMapping("/recent")
    @Operation(summary = "Recent changes", description = "Buffered change events newer than a version, oldest first")
    public ResponseEntity<ApiResponse<List<TopologyChangeEvent>>> recent(
            @Parameter(description = "Only events after this version") @RequestParam(defaultValue = "0") long afterVersion,
            @Parameter(description = "Maximum number of events") @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(ApiResponse.success(eventHub.recent(afterVersion, limit)));
    }
}
