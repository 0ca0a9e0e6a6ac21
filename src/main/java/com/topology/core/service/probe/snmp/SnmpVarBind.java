package com.topology.core.service.probe.snmp;

/**
 * A variable binding rendered for parsing.
 *
 * @param oid  dotted OID without leading dot
 * @param text display form of the value
 * @param hex  colon separated hex of octet string values, null for other types
 */
public record SnmpVarBind(String oid, String text, String hex) {

    /**
     * Index suffix of this binding below a table column OID.
     */
    public String indexBelow(String columnOid) {
        var prefix = columnOid + ".";
        return oid.startsWith(prefix) ? oid.substring(prefix.length()) : null;
    }
}
