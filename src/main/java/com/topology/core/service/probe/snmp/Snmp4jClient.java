package com.topology.core.service.probe.snmp;

import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeException;
import com.topology.core.service.probe.ProbeTarget;
import com.topology.core.service.probe.TargetCredentials;
import lombok.extern.slf4j.Slf4j;
import org.snmp4j.CommunityTarget;
import org.snmp4j.MessageDispatcherImpl;
import org.snmp4j.PDU;
import org.snmp4j.ScopedPDU;
import org.snmp4j.Snmp;
import org.snmp4j.Target;
import org.snmp4j.UserTarget;
import org.snmp4j.event.ResponseEvent;
import org.snmp4j.mp.MPv1;
import org.snmp4j.mp.MPv2c;
import org.snmp4j.mp.MPv3;
import org.snmp4j.mp.SnmpConstants;
import org.snmp4j.security.AuthHMAC192SHA256;
import org.snmp4j.security.AuthMD5;
import org.snmp4j.security.AuthSHA;
import org.snmp4j.security.PrivAES128;
import org.snmp4j.security.PrivAES256;
import org.snmp4j.security.PrivDES;
import org.snmp4j.security.SecurityLevel;
import org.snmp4j.security.SecurityProtocols;
import org.snmp4j.security.USM;
import org.snmp4j.security.UsmUser;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.UdpAddress;
import org.snmp4j.smi.Variable;
import org.snmp4j.smi.VariableBinding;
import org.snmp4j.transport.DefaultUdpTransportMapping;
import org.snmp4j.util.DefaultPDUFactory;
import org.snmp4j.util.RetrievalEvent;
import org.snmp4j.util.TreeEvent;
import org.snmp4j.util.TreeListener;
import org.snmp4j.util.TreeUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * SNMP v2c/v3 client on top of SNMP4J.
 *
 * Each session owns its own transport and USM, so concurrent probes do not
 * share security state. Walks are bounded by the timeout the session was
 * opened with. Retries are left to the discovery coordinator.
 */
@Slf4j
@Component
public class Snmp4jClient implements SnmpClient {

    private static final int MAX_REPETITIONS = 25;

    static {
        SecurityProtocols.getInstance().addDefaultProtocols();
    }

    @Override
    public SnmpSession open(ProbeTarget target, Duration timeout) throws ProbeException {
        var credentials = target.credentials();
        var address = new UdpAddress(target.resolveAddress(), credentials.snmpPort());

        var dispatcher = new MessageDispatcherImpl();
        dispatcher.addMessageProcessingModel(new MPv1());
        dispatcher.addMessageProcessingModel(new MPv2c());

        Target<UdpAddress> snmpTarget;
        if (credentials.isSnmpV3()) {
            var usm = new USM(SecurityProtocols.getInstance(), new OctetString(MPv3.createLocalEngineID()), 0);
            usm.addUser(buildUser(credentials));
            dispatcher.addMessageProcessingModel(new MPv3(usm));
            snmpTarget = userTarget(credentials, address);
        } else {
            snmpTarget = communityTarget(credentials, address);
        }
        snmpTarget.setRetries(0);
        snmpTarget.setTimeout(Math.max(1L, timeout.toMillis()));

        // The transport binds a socket, so it is created last and closed on any failure.
        DefaultUdpTransportMapping transport = null;
        try {
            transport = new DefaultUdpTransportMapping();
            var snmp = new Snmp(dispatcher, transport);
            snmp.listen();
            log.debug("Opened SNMP {} session to {}", credentials.snmpVersion(), address);
            return new Snmp4jSession(snmp, snmpTarget, credentials.isSnmpV3(),
                    System.nanoTime() + timeout.toNanos());
        } catch (IOException e) {
            closeTransport(transport);
            throw new ProbeException(ProbeErrorType.UNREACHABLE,
                    "Cannot open SNMP transport to " + target.label() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            closeTransport(transport);
            throw e;
        }
    }

    private static void closeTransport(DefaultUdpTransportMapping transport) {
        if (transport == null) {
            return;
        }
        try {
            transport.close();
        } catch (IOException e) {
            log.debug("Error closing SNMP transport: {}", e.getMessage());
        }
    }

    // ==================== Target Construction ====================

    private CommunityTarget<UdpAddress> communityTarget(TargetCredentials credentials, UdpAddress address) {
        var target = new CommunityTarget<UdpAddress>();
        target.setCommunity(new OctetString(credentials.community()));
        target.setAddress(address);
        target.setVersion(SnmpConstants.version2c);
        return target;
    }

    private UserTarget<UdpAddress> userTarget(TargetCredentials credentials, UdpAddress address) {
        var target = new UserTarget<UdpAddress>();
        target.setAddress(address);
        target.setVersion(SnmpConstants.version3);
        target.setSecurityName(new OctetString(credentials.username()));
        target.setSecurityLevel(securityLevel(credentials));
        return target;
    }

    /**
     * @throws ProbeException AUTH_FAILURE if the credentials name a protocol SNMP4J lacks
     */
    static UsmUser buildUser(TargetCredentials credentials) throws ProbeException {
        try {
            return usmUser(credentials);
        } catch (IllegalArgumentException e) {
            throw new ProbeException(ProbeErrorType.AUTH_FAILURE, e.getMessage(), e);
        }
    }

    private static UsmUser usmUser(TargetCredentials credentials) {
        var hasAuth = credentials.authPassphrase() != null;
        var hasPriv = hasAuth && credentials.privPassphrase() != null;
        return new UsmUser(
                new OctetString(credentials.username()),
                hasAuth ? authProtocol(credentials.authProtocol()) : null,
                hasAuth ? new OctetString(credentials.authPassphrase()) : null,
                hasPriv ? privProtocol(credentials.privProtocol()) : null,
                hasPriv ? new OctetString(credentials.privPassphrase()) : null);
    }

    private int securityLevel(TargetCredentials credentials) {
        if (credentials.authPassphrase() == null) return SecurityLevel.NOAUTH_NOPRIV;
        if (credentials.privPassphrase() == null) return SecurityLevel.AUTH_NOPRIV;
        return SecurityLevel.AUTH_PRIV;
    }

    static OID authProtocol(String name) {
        return switch (name == null ? "SHA" : name.toUpperCase(Locale.ROOT)) {
            case "MD5" -> AuthMD5.ID;
            case "SHA256" -> AuthHMAC192SHA256.ID;
            case "SHA" -> AuthSHA.ID;
            default -> throw new IllegalArgumentException("Unsupported SNMP auth protocol: " + name);
        };
    }

    static OID privProtocol(String name) {
        return switch (name == null ? "AES128" : name.toUpperCase(Locale.ROOT)) {
            case "DES" -> PrivDES.ID;
            case "AES", "AES128" -> PrivAES128.ID;
            case "AES256" -> PrivAES256.ID;
            default -> throw new IllegalArgumentException("Unsupported SNMP privacy protocol: " + name);
        };
    }

    // ==================== Session ====================

    private static final class Snmp4jSession implements SnmpSession {

        private final Snmp snmp;
        private final Target<UdpAddress> target;
        private final boolean v3;
        private final long deadlineNanos;

        private Snmp4jSession(Snmp snmp, Target<UdpAddress> target, boolean v3, long deadlineNanos) {
            this.snmp = snmp;
            this.target = target;
            this.v3 = v3;
            this.deadlineNanos = deadlineNanos;
        }

        @Override
        public Map<String, SnmpVarBind> get(List<String> oids) throws ProbeException {
            PDU pdu = v3 ? new ScopedPDU() : new PDU();
            pdu.setType(PDU.GET);
            oids.forEach(oid -> pdu.add(new VariableBinding(new OID(oid))));

            ResponseEvent<UdpAddress> event = send(pdu);
            PDU response = event.getResponse();
            if (response == null) {
                throw ProbeException.timeout("No SNMP response from " + target.getAddress());
            }
            if (response.getType() == PDU.REPORT) {
                throw new ProbeException(ProbeErrorType.AUTH_FAILURE,
                        "SNMPv3 report from " + target.getAddress() + ": " + response.getVariableBindings());
            }
            if (response.getErrorStatus() == PDU.authorizationError) {
                throw new ProbeException(ProbeErrorType.AUTH_FAILURE, "SNMP authorization error");
            }
            if (response.getErrorStatus() != PDU.noError) {
                throw ProbeException.malformed("SNMP error: " + response.getErrorStatusText());
            }

            var values = new LinkedHashMap<String, SnmpVarBind>();
            for (VariableBinding binding : response.getVariableBindings()) {
                if (!binding.getVariable().isException()) {
                    var rendered = render(binding);
                    values.put(rendered.oid(), rendered);
                }
            }
            return values;
        }

        @Override
        public List<SnmpVarBind> walk(String rootOid) throws ProbeException {
            var treeUtils = new TreeUtils(snmp, new DefaultPDUFactory(PDU.GETBULK));
            treeUtils.setMaxRepetitions(MAX_REPETITIONS);

            var listener = new WalkListener();
            treeUtils.getSubtree(target, new OID(rootOid), null, listener);
            awaitWalk(rootOid, listener);

            var rows = new ArrayList<SnmpVarBind>();
            for (TreeEvent event : listener.events()) {
                if (event.isError()) {
                    throw mapWalkError(rootOid, event);
                }
                VariableBinding[] bindings = event.getVariableBindings();
                if (bindings == null) continue;
                for (VariableBinding binding : bindings) {
                    if (binding != null && !binding.getVariable().isException()) {
                        rows.add(render(binding));
                    }
                }
            }
            return rows;
        }

        /**
         * Waits for the walk until the session deadline. An unfinished walk is
         * abandoned: the listener refuses further responses.
         */
        private void awaitWalk(String rootOid, WalkListener listener) throws ProbeException {
            try {
                if (!listener.await(deadlineNanos - System.nanoTime())) {
                    listener.abandon();
                    throw ProbeException.timeout("Walk of " + rootOid + " did not finish before the deadline");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                listener.abandon();
                throw new ProbeException(ProbeErrorType.CANCELLED, "Walk of " + rootOid + " interrupted");
            }
        }

        @Override
        public void close() {
            try {
                snmp.close();
            } catch (IOException e) {
                log.debug("Error closing SNMP session to {}: {}", target.getAddress(), e.getMessage());
            }
        }

        private ResponseEvent<UdpAddress> send(PDU pdu) throws ProbeException {
            try {
                return snmp.get(pdu, target);
            } catch (IOException e) {
                throw new ProbeException(ProbeErrorType.UNREACHABLE,
                        "SNMP request to " + target.getAddress() + " failed: " + e.getMessage(), e);
            }
        }

        private ProbeException mapWalkError(String rootOid, TreeEvent event) {
            var message = "Walk of " + rootOid + " failed: " + event.getErrorMessage();
            return switch (event.getStatus()) {
                case RetrievalEvent.STATUS_TIMEOUT -> ProbeException.timeout(message);
                case RetrievalEvent.STATUS_REPORT -> new ProbeException(ProbeErrorType.AUTH_FAILURE, message);
                default -> ProbeException.malformed(message);
            };
        }

        private static SnmpVarBind render(VariableBinding binding) {
            Variable variable = binding.getVariable();
            String hex = variable instanceof OctetString octets ? octets.toHexString(':') : null;
            return new SnmpVarBind(binding.getOid().toDottedString(), variable.toString(), hex);
        }
    }

    /**
     * Collects the events of an asynchronous subtree walk.
     */
    static final class WalkListener implements TreeListener {

        private final List<TreeEvent> events = new ArrayList<>();
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile boolean abandoned;

        @Override
        public synchronized boolean next(TreeEvent event) {
            events.add(event);
            return !abandoned;
        }

        @Override
        public synchronized void finished(TreeEvent event) {
            events.add(event);
            done.countDown();
        }

        @Override
        public boolean isFinished() {
            return abandoned || done.getCount() == 0;
        }

        boolean await(long nanos) throws InterruptedException {
            return done.await(Math.max(0, nanos), TimeUnit.NANOSECONDS);
        }

        void abandon() {
            abandoned = true;
        }

        synchronized List<TreeEvent> events() {
            return List.copyOf(events);
        }
    }
}
