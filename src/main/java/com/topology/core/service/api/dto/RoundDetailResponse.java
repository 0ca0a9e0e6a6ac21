package com.topology.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.topology.core.service.audit.RoundAudit;
import com.topology.core.service.discovery.PairOutcome;
import com.topology.core.service.discovery.PairStatus;
import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-pair status report of one round.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoundDetailResponse {

    private RoundSummaryResponse summary;

    private List<PairResponse> pairs;

    /**
     * Dominant error when every pair failed.
     */
    private ErrorResponse aggregatedError;

    /**
     * Raw records, only when requested.
     */
    private List<DiscoveryRecord> records;

    public static RoundDetailResponse from(RoundAudit audit, boolean includeRecords) {
        return RoundDetailResponse.builder()
                .summary(RoundSummaryResponse.from(audit))
                .pairs(audit.pairs().stream().map(PairResponse::from).toList())
                .aggregatedError(audit.aggregatedError() == null ? null
                        : new ErrorResponse(audit.aggregatedError().type(), audit.aggregatedError().message()))
                .records(includeRecords ? audit.records() : null)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PairResponse {
        private String target;
        private ProbeKind probe;
        private PairStatus status;
        private int attempts;
        private int recordCount;
        private long elapsedMs;
        private ErrorResponse error;

        static PairResponse from(PairOutcome pair) {
            return PairResponse.builder()
                    .target(pair.target())
                    .probe(pair.probe())
                    .status(pair.status())
                    .attempts(pair.attempts())
                    .recordCount(pair.recordCount())
                    .elapsedMs(pair.elapsed() == null ? 0 : pair.elapsed().toMillis())
                    .error(pair.error() == null ? null : new ErrorResponse(pair.error().type(), pair.error().message()))
                    .build();
        }
    }

    public record ErrorResponse(ProbeErrorType type, String message) {
    }
}
