package com.topology.core.service.discovery;

import com.topology.core.service.config.InventoryConfig;
import com.topology.core.service.model.MacAddresses;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeTarget;
import com.topology.core.service.probe.TargetCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds probe targets from the configured inventory and resolves named
 * credential sets.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TargetInventory {

    private final InventoryConfig inventoryConfig;

    public List<ProbeTarget> targets() {
        return inventoryConfig.getTargets().stream()
                .map(this::toTarget)
                .toList();
    }

    public boolean isEmpty() {
        return inventoryConfig.getTargets().isEmpty();
    }

    /**
     * Probe kinds used for targets that name none.
     */
    public Set<ProbeKind> defaultProbes() {
        return parseKinds(inventoryConfig.getDefaultProbes());
    }

    /**
     * Builds a target. Without explicit probes it gets the default kinds the
     * target can run, or every kind it can run when no default fits: an
     * interface-only target then gets the passive listeners.
     *
     * @throws DiscoveryException UNKNOWN_CREDENTIALS if the credentials reference is not configured
     * @throws IllegalArgumentException if an explicit probe needs a host or interface the target lacks
     */
    public ProbeTarget target(String host, String interfaceName, String mac,
                              String credentialsRef, Collection<String> probes) {
        var normalizedMac = mac == null ? null : MacAddresses.normalize(mac).orElseThrow(
                () -> new IllegalArgumentException("Invalid MAC address: " + mac));
        var bare = new ProbeTarget(host, interfaceName, normalizedMac, credentials(credentialsRef), Set.of());
        var kinds = probes == null || probes.isEmpty()
                ? supportedDefaults(bare)
                : requireSupported(bare, parseKinds(probes));
        return new ProbeTarget(host, interfaceName, normalizedMac, bare.credentials(), kinds);
    }

    private Set<ProbeKind> supportedDefaults(ProbeTarget target) {
        var kinds = EnumSet.noneOf(ProbeKind.class);
        defaultProbes().stream().filter(target::supports).forEach(kinds::add);
        if (kinds.isEmpty()) {
            Arrays.stream(ProbeKind.values()).filter(target::supports).forEach(kinds::add);
        }
        return kinds;
    }

    private static Set<ProbeKind> requireSupported(ProbeTarget target, Set<ProbeKind> kinds) {
        for (var kind : kinds) {
            if (!target.supports(kind)) {
                throw new IllegalArgumentException(String.format("Probe %s needs %s, which target %s lacks",
                        kind, kind.isPassive() ? "an interface" : "a host", target.label()));
            }
        }
        return kinds;
    }

    /**
     * Resolves a named credential set; a null reference yields the defaults.
     *
     * @throws DiscoveryException UNKNOWN_CREDENTIALS if the name is not configured
     */
    public TargetCredentials credentials(String credentialsRef) {
        if (credentialsRef == null || credentialsRef.isBlank()) {
            return TargetCredentials.defaults();
        }
        var props = inventoryConfig.getCredentials().get(credentialsRef);
        if (props == null) {
            throw new DiscoveryException("Unknown credentials reference: " + credentialsRef,
                    credentialsRef, DiscoveryException.UNKNOWN_CREDENTIALS);
        }
        return TargetCredentials.builder()
                .snmpVersion(props.getSnmpVersion())
                .snmpPort(props.getSnmpPort())
                .community(props.getCommunity())
                .username(props.getUsername())
                .authProtocol(props.getAuthProtocol())
                .authPassphrase(props.getAuthPassphrase())
                .privProtocol(props.getPrivProtocol())
                .privPassphrase(props.getPrivPassphrase())
                .apiUsername(props.getApiUsername())
                .apiPassword(props.getApiPassword())
                .apiPort(props.getApiPort())
                .apiTls(props.isApiTls())
                .sshUsername(props.getSshUsername())
                .sshPassword(props.getSshPassword())
                .sshPort(props.getSshPort())
                .sshHostKey(props.getSshHostKey())
                .build();
    }

    /**
     * Parses probe names.
     *
     * @throws IllegalArgumentException for an unknown probe name
     */
    public static Set<ProbeKind> parseKinds(Collection<String> names) {
        var kinds = EnumSet.noneOf(ProbeKind.class);
        if (names != null) {
            names.forEach(name -> kinds.add(ProbeKind.parse(name)));
        }
        return kinds;
    }

    private ProbeTarget toTarget(InventoryConfig.TargetProperties props) {
        return target(props.getHost(), props.getInterfaceName(), props.getMac(),
                props.getCredentialsRef(), props.getProbes());
    }
}
