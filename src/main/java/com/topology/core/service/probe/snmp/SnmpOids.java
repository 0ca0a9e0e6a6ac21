package com.topology.core.service.probe.snmp;

/**
 * OIDs read by the SNMP query probe (SNMPv2-MIB, IF-MIB, IP-MIB, LLDP-MIB).
 */
final class SnmpOids {

    static final String SYS_DESCR = "1.3.6.1.2.1.1.1.0";
    static final String SYS_OBJECT_ID = "1.3.6.1.2.1.1.2.0";
    static final String SYS_NAME = "1.3.6.1.2.1.1.5.0";
    static final String SYS_LOCATION = "1.3.6.1.2.1.1.6.0";

    static final String IF_PHYS_ADDRESS = "1.3.6.1.2.1.2.2.1.6";

    static final String IP_NET_TO_MEDIA_PHYS_ADDRESS = "1.3.6.1.2.1.4.22.1.2";

    static final String LLDP_LOC_CHASSIS_ID_SUBTYPE = "1.0.8802.1.1.2.1.3.1.0";
    static final String LLDP_LOC_CHASSIS_ID = "1.0.8802.1.1.2.1.3.2.0";

    static final String LLDP_REM_ENTRY = "1.0.8802.1.1.2.1.4.1.1";
    static final String LLDP_REM_CHASSIS_ID_SUBTYPE = LLDP_REM_ENTRY + ".4";
    static final String LLDP_REM_CHASSIS_ID = LLDP_REM_ENTRY + ".5";
    static final String LLDP_REM_PORT_ID = LLDP_REM_ENTRY + ".7";
    static final String LLDP_REM_SYS_NAME = LLDP_REM_ENTRY + ".9";
    static final String LLDP_REM_SYS_DESC = LLDP_REM_ENTRY + ".10";

    static final String CHASSIS_SUBTYPE_MAC = "4";

    private SnmpOids() {
    }
}
