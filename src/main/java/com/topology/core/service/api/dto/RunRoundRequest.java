package com.topology.core.service.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to run a discovery round over explicit targets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRoundRequest {

    @NotEmpty(message = "targets are required")
    @Valid
    private List<TargetRequest> targets;

    /**
     * Probe kinds to run; empty uses each target's own probe set.
     */
    private List<String> probes;

    @Valid
    private RoundConfigRequest config;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TargetRequest {

        private String host;

        /**
         * Local capture interface for passive listeners.
         */
        private String interfaceName;

        private String mac;

        /**
         * Name of a configured credential set.
         */
        private String credentialsRef;

        private List<String> probes;

        @AssertTrue(message = "each target needs a host or an interfaceName")
        public boolean isAddressable() {
            return (host != null && !host.isBlank()) || (interfaceName != null && !interfaceName.isBlank());
        }
    }
}
