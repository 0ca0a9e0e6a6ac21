package com.topology.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Target inventory and named credentials used by discovery rounds.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "topology.inventory")
public class InventoryConfig {

    /**
     * Probe kinds used when neither the target nor the request names any.
     */
    private List<String> defaultProbes = new ArrayList<>(List.of("SNMP_QUERY"));

    private List<TargetProperties> targets = new ArrayList<>();

    /**
     * Credential sets referenced by name from targets.
     */
    private Map<String, CredentialProperties> credentials = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class TargetProperties {

        /**
         * Host name or address to query.
         */
        private String host;

        /**
         * Local capture interface for passive listeners.
         */
        private String interfaceName;

        /**
         * Known MAC address of the target, if any.
         */
        private String mac;

        private String credentialsRef;

        private List<String> probes = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class CredentialProperties {

        /**
         * "v2c" or "v3".
         */
        private String snmpVersion = "v2c";

        private int snmpPort = 161;

        private String community = "public";

        private String username;

        private String authProtocol = "SHA";

        private String authPassphrase;

        private String privProtocol = "AES128";

        private String privPassphrase;

        private String apiUsername;

        private String apiPassword;

        private int apiPort = 443;

        private boolean apiTls = true;

        private String sshUsername;

        private String sshPassword;

        private int sshPort = 22;

        /**
         * Expected SSH host key fingerprint ("SHA256:..."). Any key is
         * accepted when unset.
         */
        private String sshHostKey;
    }
}
