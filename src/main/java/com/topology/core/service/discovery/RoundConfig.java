package com.topology.core.service.discovery;

import com.topology.core.service.config.DiscoveryConfig;
import lombok.Builder;

import java.time.Duration;

/**
 * Timing and retry settings for one discovery round.
 */
@Builder(toBuilder = true)
public record RoundConfig(
        Duration probeTimeout,
        int maxConcurrency,
        int maxRetries,
        int unreachableMaxRetries,
        Duration backoffInitial,
        double backoffMultiplier,
        Duration backoffMax,
        Duration roundDeadline
) {

    public RoundConfig {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        if (maxRetries < 0 || unreachableMaxRetries < 0) {
            throw new IllegalArgumentException("retry limits must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
    }

    public static RoundConfig from(DiscoveryConfig.RoundDefaults defaults) {
        return RoundConfig.builder()
                .probeTimeout(Duration.ofMillis(defaults.getProbeTimeoutMs()))
                .maxConcurrency(defaults.getMaxConcurrency())
                .maxRetries(defaults.getMaxRetries())
                .unreachableMaxRetries(defaults.getUnreachableMaxRetries())
                .backoffInitial(Duration.ofMillis(defaults.getBackoffInitialMs()))
                .backoffMultiplier(defaults.getBackoffMultiplier())
                .backoffMax(Duration.ofMillis(defaults.getBackoffMaxMs()))
                .roundDeadline(Duration.ofMillis(defaults.getRoundDeadlineMs()))
                .build();
    }

    /**
     * Delay before retry number {@code retry} (1-based), exponential and capped.
     */
    public Duration backoffDelay(int retry) {
        double millis = backoffInitial.toMillis() * Math.pow(backoffMultiplier, Math.max(0, retry - 1));
        return Duration.ofMillis((long) Math.min(millis, backoffMax.toMillis()));
    }

    /**
     * Retry budget for an error, where unreachable targets get the smaller cap.
     */
    public int retryLimitFor(boolean unreachable) {
        return unreachable ? Math.min(unreachableMaxRetries, maxRetries) : maxRetries;
    }
}
