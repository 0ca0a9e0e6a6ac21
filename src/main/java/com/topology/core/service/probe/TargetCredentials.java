package com.topology.core.service.probe;

import lombok.Builder;

/**
 * Credentials a probe may need for a target. Fields not relevant to a
 * probe are ignored by it.
 */
@Builder
public record TargetCredentials(
        String snmpVersion,
        int snmpPort,
        String community,
        String username,
        String authProtocol,
        String authPassphrase,
        String privProtocol,
        String privPassphrase,
        String apiUsername,
        String apiPassword,
        int apiPort,
        boolean apiTls,
        String sshUsername,
        String sshPassword,
        int sshPort,
        String sshHostKey
) {

    public static TargetCredentials defaults() {
        return TargetCredentials.builder()
                .snmpVersion("v2c")
                .snmpPort(161)
                .community("public")
                .apiPort(443)
                .apiTls(true)
                .sshPort(22)
                .build();
    }

    public boolean isSnmpV3() {
        return "v3".equalsIgnoreCase(snmpVersion);
    }

    @Override
    public String toString() {
        return "TargetCredentials[snmpVersion=" + snmpVersion + ", username=" + username
                + ", apiUsername=" + apiUsername + ", sshUsername=" + sshUsername + "]";
    }
}
