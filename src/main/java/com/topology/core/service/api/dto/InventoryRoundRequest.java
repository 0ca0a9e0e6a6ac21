package com.topology.core.service.api.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Optional body for an inventory round.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryRoundRequest {

    /**
     * Probe kinds to run on every target instead of the configured ones.
     */
    private List<String> probes;

    @Valid
    private RoundConfigRequest config;
}
