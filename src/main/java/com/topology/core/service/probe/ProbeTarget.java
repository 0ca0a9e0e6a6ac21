package com.topology.core.service.probe;

import java.net.InetAddress;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A network element or capture interface a probe runs against.
 *
 * @param host          address or name to query; for passive listeners the
 *                      address of the listening device
 * @param interfaceName local capture interface, used by passive listeners
 * @param mac           known MAC of the target, if any
 * @param probes        probe kinds allowed for this target; empty allows all
 */
public record ProbeTarget(
        String host,
        String interfaceName,
        String mac,
        TargetCredentials credentials,
        Set<ProbeKind> probes
) {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})(\\.\\d{1,3}){3}$");

    public ProbeTarget {
        credentials = credentials == null ? TargetCredentials.defaults() : credentials;
        probes = probes == null ? Set.of() : Set.copyOf(probes);
    }

    public static ProbeTarget host(String host) {
        return new ProbeTarget(host, null, null, null, Set.of());
    }

    public boolean allows(ProbeKind kind) {
        return probes.isEmpty() || probes.contains(kind);
    }

    /**
     * Whether the target carries what the kind needs: an interface for
     * passive listeners, a host for everything else.
     */
    public boolean supports(ProbeKind kind) {
        return kind.isPassive() ? hasText(interfaceName) : hasText(host);
    }

    /**
     * Label used in logs and pair reports.
     */
    public String label() {
        if (host != null) return host;
        return interfaceName != null ? interfaceName : "unknown";
    }

    public boolean isAddressLiteral() {
        return host != null && (IPV4.matcher(host).matches() || host.contains(":"));
    }

    /**
     * @throws ProbeException UNREACHABLE for an interface-only target, which has no address to query
     */
    public InetAddress resolveAddress() throws ProbeException {
        if (!hasText(host)) {
            throw new ProbeException(ProbeErrorType.UNREACHABLE, "Target " + label() + " has no host to query");
        }
        try {
            return InetAddress.getByName(host);
        } catch (Exception e) {
            throw new ProbeException(ProbeErrorType.UNREACHABLE, "Cannot resolve host " + host, e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
