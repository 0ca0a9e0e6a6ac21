package com.topology.core.service.probe;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Best-effort vendor and device type classification from free-text
 * descriptions and SNMP enterprise numbers.
 */
public final class VendorFingerprint {

    private static final String ENTERPRISE_PREFIX = "1.3.6.1.4.1.";

    private static final Map<String, String> ENTERPRISES = Map.of(
            "9", "Cisco",
            "14988", "MikroTik",
            "2636", "Juniper",
            "11", "HP",
            "2011", "Huawei",
            "41112", "Ubiquiti",
            "674", "Dell",
            "12356", "Fortinet",
            "25461", "Palo Alto Networks",
            "30065", "Arista"
    );

    private static final Map<String, String> DESCRIPTION_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, String> TYPE_KEYWORDS = new LinkedHashMap<>();

    static {
        DESCRIPTION_KEYWORDS.put("cisco", "Cisco");
        DESCRIPTION_KEYWORDS.put("routeros", "MikroTik");
        DESCRIPTION_KEYWORDS.put("mikrotik", "MikroTik");
        DESCRIPTION_KEYWORDS.put("junos", "Juniper");
        DESCRIPTION_KEYWORDS.put("juniper", "Juniper");
        DESCRIPTION_KEYWORDS.put("huawei", "Huawei");
        DESCRIPTION_KEYWORDS.put("procurve", "HP");
        DESCRIPTION_KEYWORDS.put("aruba", "HP");
        DESCRIPTION_KEYWORDS.put("ubiquiti", "Ubiquiti");
        DESCRIPTION_KEYWORDS.put("edgeos", "Ubiquiti");
        DESCRIPTION_KEYWORDS.put("fortigate", "Fortinet");
        DESCRIPTION_KEYWORDS.put("arista", "Arista");
        DESCRIPTION_KEYWORDS.put("linux", "Linux");
        DESCRIPTION_KEYWORDS.put("windows", "Microsoft");

        TYPE_KEYWORDS.put("firewall", "firewall");
        TYPE_KEYWORDS.put("fortigate", "firewall");
        TYPE_KEYWORDS.put("router", "router");
        TYPE_KEYWORDS.put("routeros", "router");
        TYPE_KEYWORDS.put("switch", "switch");
        TYPE_KEYWORDS.put("catalyst", "switch");
        TYPE_KEYWORDS.put("access point", "access_point");
        TYPE_KEYWORDS.put("printer", "printer");
        TYPE_KEYWORDS.put("windows", "workstation");
        TYPE_KEYWORDS.put("linux", "server");
    }

    private VendorFingerprint() {
    }

    public static Optional<String> vendorFromEnterpriseOid(String sysObjectId) {
        if (sysObjectId == null) {
            return Optional.empty();
        }
        var oid = sysObjectId.startsWith(".") ? sysObjectId.substring(1) : sysObjectId;
        if (!oid.startsWith(ENTERPRISE_PREFIX)) {
            return Optional.empty();
        }
        var rest = oid.substring(ENTERPRISE_PREFIX.length());
        int dot = rest.indexOf('.');
        var enterprise = dot < 0 ? rest : rest.substring(0, dot);
        return Optional.ofNullable(ENTERPRISES.get(enterprise));
    }

    public static Optional<String> vendorFromDescription(String description) {
        return firstKeywordMatch(description, DESCRIPTION_KEYWORDS);
    }

    public static Optional<String> deviceTypeFromDescription(String description) {
        return firstKeywordMatch(description, TYPE_KEYWORDS);
    }

    private static Optional<String> firstKeywordMatch(String text, Map<String, String> keywords) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        var lower = text.toLowerCase(Locale.ROOT);
        return keywords.entrySet().stream()
                .filter(entry -> lower.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
