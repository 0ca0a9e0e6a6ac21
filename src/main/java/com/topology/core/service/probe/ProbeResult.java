package com.topology.core.service.probe;

import com.topology.core.service.model.DiscoveryRecord;

import java.util.List;

/**
 * Outcome of one probe attempt: the records collected and, if the attempt
 * did not finish cleanly, the error that stopped it.
 */
public record ProbeResult(List<DiscoveryRecord> records, ProbeError error) {

    public ProbeResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static ProbeResult success(List<DiscoveryRecord> records) {
        return new ProbeResult(records, null);
    }

    public static ProbeResult partial(List<DiscoveryRecord> records, ProbeError error) {
        return new ProbeResult(records, error);
    }

    public static ProbeResult failure(ProbeError error) {
        return new ProbeResult(List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasRecords() {
        return !records.isEmpty();
    }
}
