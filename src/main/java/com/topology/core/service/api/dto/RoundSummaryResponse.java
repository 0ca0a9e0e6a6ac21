package com.topology.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.topology.core.service.audit.RoundAudit;
import com.topology.core.service.audit.RoundPhase;
import com.topology.core.service.discovery.PairStatus;
import com.topology.core.service.discovery.RoundOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Lightweight view of a round for listing endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoundSummaryResponse {

    private String roundId;

    /**
     * What requested the round: api, inventory or schedule.
     */
    private String trigger;

    private RoundPhase phase;

    /**
     * Probe-phase outcome, once the round ran.
     */
    private RoundOutcome outcome;

    private Instant queuedAt;
    private Instant startedAt;
    private Instant finishedAt;

    private int pairCount;
    private long failedPairs;
    private int recordCount;

    /**
     * Snapshot version current after commit.
     */
    private Long committedVersion;

    private int findingCount;

    private String failureReason;

    public static RoundSummaryResponse from(RoundAudit audit) {
        return RoundSummaryResponse.builder()
                .roundId(audit.roundId())
                .trigger(audit.trigger())
                .phase(audit.phase())
                .outcome(audit.outcome())
                .queuedAt(audit.queuedAt())
                .startedAt(audit.startedAt())
                .finishedAt(audit.finishedAt())
                .pairCount(audit.pairs().size())
                .failedPairs(audit.pairs().stream().filter(pair -> pair.status() == PairStatus.FAILED).count())
                .recordCount(audit.records().size())
                .committedVersion(audit.committedVersion())
                .findingCount(audit.findingCount())
                .failureReason(audit.failureReason())
                .build();
    }
}
