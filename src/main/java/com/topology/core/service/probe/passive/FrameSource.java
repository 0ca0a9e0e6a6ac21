package com.topology.core.service.probe.passive;

import com.topology.core.service.probe.ProbeException;

/**
 * Opens link-layer captures on a local interface.
 */
public interface FrameSource {

    /**
     * Opens a capture on an interface restricted by a BPF filter.
     *
     * @throws ProbeException UNREACHABLE if the interface does not exist or cannot be opened
     */
    FrameCapture open(String interfaceName, String filter, int snapLength) throws ProbeException;

    /**
     * An open capture. {@link #nextFrame()} waits at most a short read
     * timeout so callers can check their deadline between frames.
     */
    interface FrameCapture extends AutoCloseable {

        /**
         * @return the next raw frame, or null if none arrived within the read timeout
         */
        byte[] nextFrame() throws ProbeException;

        @Override
        void close();
    }
}
