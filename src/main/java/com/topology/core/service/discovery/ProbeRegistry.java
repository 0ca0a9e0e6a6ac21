package com.topology.core.service.discovery;

import com.topology.core.service.probe.Probe;
import com.topology.core.service.probe.ProbeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Looks up probe strategies by kind.
 */
@Slf4j
@Component
public class ProbeRegistry {

    private final Map<ProbeKind, Probe> probes = new EnumMap<>(ProbeKind.class);

    public ProbeRegistry(List<Probe> available) {
        for (var probe : available) {
            var previous = probes.put(probe.kind(), probe);
            if (previous != null) {
                throw new IllegalStateException("Two probes registered for " + probe.kind());
            }
        }
        log.info("Registered probes: {}", probes.keySet());
    }

    /**
     * Resolves a probe set in enum order.
     *
     * @throws DiscoveryException INVALID_PROBE if a kind has no registered probe
     */
    public List<Probe> resolve(Collection<ProbeKind> kinds) {
        return kinds.stream()
                .distinct()
                .sorted()
                .map(this::require)
                .toList();
    }

    public Set<ProbeKind> registeredKinds() {
        return Set.copyOf(probes.keySet());
    }

    private Probe require(ProbeKind kind) {
        var probe = probes.get(kind);
        if (probe == null) {
            throw new DiscoveryException("No probe registered for " + kind, kind.name(),
                    DiscoveryException.INVALID_PROBE);
        }
        return probe;
    }
}
