package com.topology.core.service.api.dto;

import com.topology.core.service.discovery.RoundConfig;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Per-round overrides of the configured round defaults. Unset fields keep
 * the default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoundConfigRequest {

    /**
     * One hour; also keeps every duration well inside nanosecond range.
     */
    static final long MAX_DURATION_MS = 3_600_000L;

    @Positive(message = "probeTimeoutMs must be positive")
    @Max(value = MAX_DURATION_MS, message = "probeTimeoutMs must not exceed one hour")
    private Long probeTimeoutMs;

    @Min(value = 1, message = "maxConcurrency must be at least 1")
    private Integer maxConcurrency;

    @Min(value = 0, message = "maxRetries must not be negative")
    private Integer maxRetries;

    @Min(value = 0, message = "unreachableMaxRetries must not be negative")
    private Integer unreachableMaxRetries;

    @Min(value = 0, message = "backoffInitialMs must not be negative")
    @Max(value = MAX_DURATION_MS, message = "backoffInitialMs must not exceed one hour")
    private Long backoffInitialMs;

    @DecimalMin(value = "1.0", message = "backoffMultiplier must be at least 1.0")
    private Double backoffMultiplier;

    @Min(value = 0, message = "backoffMaxMs must not be negative")
    @Max(value = MAX_DURATION_MS, message = "backoffMaxMs must not exceed one hour")
    private Long backoffMaxMs;

    @Positive(message = "roundDeadlineMs must be positive")
    @Max(value = MAX_DURATION_MS, message = "roundDeadlineMs must not exceed one hour")
    private Long roundDeadlineMs;

    public RoundConfig applyTo(RoundConfig defaults) {
        var builder = defaults.toBuilder();
        if (probeTimeoutMs != null) builder.probeTimeout(Duration.ofMillis(probeTimeoutMs));
        if (maxConcurrency != null) builder.maxConcurrency(maxConcurrency);
        if (maxRetries != null) builder.maxRetries(maxRetries);
        if (unreachableMaxRetries != null) builder.unreachableMaxRetries(unreachableMaxRetries);
        if (backoffInitialMs != null) builder.backoffInitial(Duration.ofMillis(backoffInitialMs));
        if (backoffMultiplier != null) builder.backoffMultiplier(backoffMultiplier);
        if (backoffMaxMs != null) builder.backoffMax(Duration.ofMillis(backoffMaxMs));
        if (roundDeadlineMs != null) builder.roundDeadline(Duration.ofMillis(roundDeadlineMs));
        return builder.build();
    }
}
