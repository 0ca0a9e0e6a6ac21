package com.topology.core.service.probe.passive;

import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeException;
import lombok.extern.slf4j.Slf4j;
import org.pcap4j.core.BpfProgram.BpfCompileMode;
import org.pcap4j.core.NotOpenException;
import org.pcap4j.core.PcapHandle;
import org.pcap4j.core.PcapNativeException;
import org.pcap4j.core.PcapNetworkInterface;
import org.pcap4j.core.PcapNetworkInterface.PromiscuousMode;
import org.pcap4j.core.Pcaps;

/**
 * libpcap-backed frame source.
 *
 * Requires libpcap on the host and capture privileges for the process.
 */
@Slf4j
public class PcapFrameSource implements FrameSource {

    private static final int READ_TIMEOUT_MS = 250;

    @Override
    public FrameCapture open(String interfaceName, String filter, int snapLength) throws ProbeException {
        if (interfaceName == null || interfaceName.isBlank()) {
            throw new ProbeException(ProbeErrorType.UNREACHABLE, "No capture interface configured");
        }
        try {
            PcapNetworkInterface nif = Pcaps.getDevByName(interfaceName);
            if (nif == null) {
                throw new ProbeException(ProbeErrorType.UNREACHABLE, "Capture interface not found: " + interfaceName);
            }
            PcapHandle handle = nif.openLive(snapLength, PromiscuousMode.PROMISCUOUS, READ_TIMEOUT_MS);
            applyFilter(handle, filter);
            log.debug("Opened capture on {} with filter '{}'", interfaceName, filter);
            return new PcapCapture(handle);
        } catch (PcapNativeException | NotOpenException e) {
            throw new ProbeException(ProbeErrorType.UNREACHABLE,
                    "Cannot capture on " + interfaceName + ": " + e.getMessage(), e);
        } catch (UnsatisfiedLinkError e) {
            throw new ProbeException(ProbeErrorType.UNREACHABLE, "libpcap is not available: " + e.getMessage(), e);
        }
    }

    /**
     * Installs the BPF filter, closing the handle if that fails.
     */
    static void applyFilter(PcapHandle handle, String filter) throws PcapNativeException, NotOpenException {
        try {
            handle.setFilter(filter, BpfCompileMode.OPTIMIZE);
        } catch (PcapNativeException | NotOpenException | RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    private static final class PcapCapture implements FrameCapture {

        private final PcapHandle handle;

        private PcapCapture(PcapHandle handle) {
            this.handle = handle;
        }

        @Override
        public byte[] nextFrame() throws ProbeException {
            try {
                return handle.getNextRawPacket();
            } catch (NotOpenException e) {
                throw new ProbeException(ProbeErrorType.INTERNAL, "Capture handle closed", e);
            }
        }

        @Override
        public void close() {
            handle.close();
        }
    }
}
