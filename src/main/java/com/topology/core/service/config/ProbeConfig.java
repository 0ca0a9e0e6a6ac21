package com.topology.core.service.config;

import com.topology.core.service.probe.Probe;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.passive.CdpFrameParser;
import com.topology.core.service.probe.passive.FrameParser;
import com.topology.core.service.probe.passive.FrameSource;
import com.topology.core.service.probe.passive.LldpFrameParser;
import com.topology.core.service.probe.passive.MndpFrameParser;
import com.topology.core.service.probe.passive.PassiveListenerProbe;
import com.topology.core.service.probe.passive.PcapFrameSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the passive listener probes and the shared clock.
 *
 * SNMP, RouterOS and Cisco CLI probes are components; the listeners share
 * one implementation and differ only by frame parser.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ProbeConfig {

    private final DiscoveryConfig discoveryConfig;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FrameSource frameSource() {
        return new PcapFrameSource();
    }

    @Bean
    public Probe lldpListenerProbe(FrameSource frameSource, Clock clock) {
        return passiveProbe(ProbeKind.LLDP_LISTENER, new LldpFrameParser(), frameSource, clock);
    }

    @Bean
    public Probe cdpListenerProbe(FrameSource frameSource, Clock clock) {
        return passiveProbe(ProbeKind.CDP_LISTENER, new CdpFrameParser(), frameSource, clock);
    }

    @Bean
    public Probe mndpListenerProbe(FrameSource frameSource, Clock clock) {
        return passiveProbe(ProbeKind.MNDP_LISTENER, new MndpFrameParser(), frameSource, clock);
    }

    private Probe passiveProbe(ProbeKind kind, FrameParser parser,
                               FrameSource frameSource, Clock clock) {
        var passive = discoveryConfig.getPassive();
        log.debug("Registering {} with a {}ms listen window", kind, passive.getListenWindowMs());
        return new PassiveListenerProbe(kind, parser, frameSource,
                Duration.ofMillis(passive.getListenWindowMs()), passive.getSnapLength(), clock);
    }
}
