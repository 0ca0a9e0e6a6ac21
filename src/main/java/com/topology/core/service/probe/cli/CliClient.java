package com.topology.core.service.probe.cli;

import com.topology.core.service.probe.ProbeException;
import com.topology.core.service.probe.ProbeTarget;

import java.time.Duration;

/**
 * An authenticated command-line session on a network device.
 */
public interface CliClient extends AutoCloseable {

    /**
     * Runs one command and returns its standard output.
     *
     * @throws ProbeException TIMEOUT if the command does not finish in time,
     *                        MALFORMED_RESPONSE if the device reports a failing exit status
     */
    String execute(String command, Duration timeout) throws ProbeException;

    @Override
    void close();

    @FunctionalInterface
    interface Factory {

        /**
         * @throws ProbeException UNREACHABLE if no session can be opened,
         *                        AUTH_FAILURE if the device rejects the credentials or host key
         */
        CliClient connect(ProbeTarget target, Duration timeout) throws ProbeException;
    }
}
