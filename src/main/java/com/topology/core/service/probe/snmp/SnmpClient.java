package com.topology.core.service.probe.snmp;

import com.topology.core.service.probe.ProbeException;
import com.topology.core.service.probe.ProbeTarget;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Minimal SNMP access used by the query probe.
 */
public interface SnmpClient {

    /**
     * Opens a session to the target's agent using its credentials.
     *
     * @param timeout per-request timeout
     */
    SnmpSession open(ProbeTarget target, Duration timeout) throws ProbeException;

    interface SnmpSession extends AutoCloseable {

        /**
         * GET of scalar OIDs; missing objects are left out of the result.
         */
        Map<String, SnmpVarBind> get(List<String> oids) throws ProbeException;

        /**
         * Walks the subtree below a root OID.
         */
        List<SnmpVarBind> walk(String rootOid) throws ProbeException;

        @Override
        void close();
    }
}
