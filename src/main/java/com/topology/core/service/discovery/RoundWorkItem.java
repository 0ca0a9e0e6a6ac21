package com.topology.core.service.discovery;

import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeTarget;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Sealed interface for queued discovery rounds.
 *
 * A round either names its targets explicitly or runs over the configured
 * inventory, resolved when the round starts.
 */
public sealed interface RoundWorkItem permits
        RoundWorkItem.TargetedRound,
        RoundWorkItem.InventoryRound {

    String getRoundId();

    RoundConfig getConfig();

    Instant getCreatedAt();

    /**
     * What the round would discover. Two waiting rounds with equal scopes
     * would produce the same observations.
     */
    RoundScope scope();

    /**
     * @param targets explicit targets; empty for an inventory round, which
     *                resolves its targets when it starts
     */
    record RoundScope(boolean inventory, Set<ProbeTarget> targets, Set<ProbeKind> probes, RoundConfig config) {
    }

    /**
     * Round over targets given with the request.
     */
    record TargetedRound(
            String roundId,
            List<ProbeTarget> targets,
            Set<ProbeKind> probes,
            RoundConfig config,
            Instant createdAt
    ) implements RoundWorkItem {

        public TargetedRound {
            targets = List.copyOf(targets);
            probes = probes == null ? Set.of() : Set.copyOf(probes);
        }

        @Override
        public String getRoundId() {
            return roundId;
        }

        @Override
        public RoundConfig getConfig() {
            return config;
        }

        @Override
        public Instant getCreatedAt() {
            return createdAt;
        }

        @Override
        public RoundScope scope() {
            return new RoundScope(false, Set.copyOf(targets), probes, config);
        }
    }

    /**
     * Round over every configured inventory target.
     *
     * @param probeOverride probe kinds to use instead of each target's own; empty keeps them
     */
    record InventoryRound(
            String roundId,
            Set<ProbeKind> probeOverride,
            RoundConfig config,
            Instant createdAt
    ) implements RoundWorkItem {

        public InventoryRound {
            probeOverride = probeOverride == null ? Set.of() : Set.copyOf(probeOverride);
        }

        @Override
        public String getRoundId() {
            return roundId;
        }

        @Override
        public RoundConfig getConfig() {
            return config;
        }

        @Override
        public Instant getCreatedAt() {
            return createdAt;
        }

        @Override
        public RoundScope scope() {
            return new RoundScope(true, Set.of(), probeOverride, config);
        }
    }
}
