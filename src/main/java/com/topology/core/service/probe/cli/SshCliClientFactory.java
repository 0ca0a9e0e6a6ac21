package com.topology.core.service.probe.cli;

import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeException;
import com.topology.core.service.probe.ProbeTarget;
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.ClientBuilder;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ClientChannel;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.config.hosts.HostConfigEntryResolver;
import org.apache.sshd.client.keyverifier.ServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.config.keys.KeyUtils;
import org.apache.sshd.common.random.RandomFactory;
import org.apache.sshd.common.random.SingletonRandomFactory;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.time.Duration;
import java.util.EnumSet;
import java.util.concurrent.TimeUnit;

/**
 * Opens password-authenticated SSH sessions with Apache MINA SSHD and runs
 * commands over exec channels.
 *
 * One client per session: sessions are short lived and never shared
 * between probe attempts.
 */
@Slf4j
@Component
public class SshCliClientFactory implements CliClient.Factory {

    // Seeding is expensive on hosts without hardware entropy, so it happens once.
    private static final RandomFactory RANDOM_FACTORY = new SingletonRandomFactory(SecurityUtils.getRandomFactory());

    @Override
    public CliClient connect(ProbeTarget target, Duration timeout) throws ProbeException {
        var credentials = target.credentials();
        if (credentials.sshUsername() == null || credentials.sshUsername().isBlank()) {
            throw new ProbeException(ProbeErrorType.AUTH_FAILURE, "No SSH credentials configured for " + target.label());
        }
        var host = target.resolveAddress().getHostAddress();
        var verifier = new HostKeyVerifier(credentials.sshHostKey(), target.label());
        SshClient client = new ClientBuilder()
                .hostConfigEntryResolver(HostConfigEntryResolver.EMPTY)
                .serverKeyVerifier(verifier)
                .randomFactory(RANDOM_FACTORY)
                .build();
        client.start();

        ClientSession session = null;
        try {
            session = openSession(client, credentials.sshUsername(), host, credentials.sshPort(),
                    timeout, verifier, target);
            authenticate(session, credentials.sshPassword(), timeout, verifier, target);
            log.debug("SSH session authenticated to {}", target.label());
            return new SshCliClient(client, session, target.label());
        } catch (ProbeException | RuntimeException e) {
            closeQuietly(session, target.label());
            client.stop();
            throw e;
        }
    }

    private static ClientSession openSession(SshClient client, String username, String host, int port,
                                             Duration timeout, HostKeyVerifier verifier,
                                             ProbeTarget target) throws ProbeException {
        try {
            return client.connect(username, host, port)
                    .verify(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .getSession();
        } catch (IOException e) {
            if (verifier.isRejected()) {
                throw hostKeyMismatch(target, e);
            }
            throw new ProbeException(ProbeErrorType.UNREACHABLE,
                    "SSH connect to " + target.label() + " failed: " + e.getMessage(), e);
        }
    }

    private static void authenticate(ClientSession session, String password, Duration timeout,
                                     HostKeyVerifier verifier, ProbeTarget target) throws ProbeException {
        try {
            session.addPasswordIdentity(password == null ? "" : password);
            session.auth().verify(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (IOException e) {
            if (verifier.isRejected()) {
                throw hostKeyMismatch(target, e);
            }
            throw new ProbeException(ProbeErrorType.AUTH_FAILURE,
                    "SSH authentication to " + target.label() + " failed: " + e.getMessage(), e);
        }
    }

    private static ProbeException hostKeyMismatch(ProbeTarget target, IOException cause) {
        return new ProbeException(ProbeErrorType.AUTH_FAILURE,
                "SSH host key of " + target.label() + " does not match the configured fingerprint", cause);
    }

    private static void closeQuietly(ClientSession session, String label) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (IOException e) {
            log.warn("Failed to close SSH session to {}", label, e);
        }
    }

    // ==================== Session ====================

    private record SshCliClient(SshClient client, ClientSession session, String label) implements CliClient {

        @Override
        public String execute(String command, Duration timeout) throws ProbeException {
            var out = new ByteArrayOutputStream();
            var err = new ByteArrayOutputStream();
            try (ClientChannel channel = session.createExecChannel(command)) {
                channel.setOut(out);
                channel.setErr(err);
                channel.open().verify(timeout.toMillis(), TimeUnit.MILLISECONDS);
                var events = channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), timeout.toMillis());
                if (events.contains(ClientChannelEvent.TIMEOUT)) {
                    throw ProbeException.timeout("'" + command + "' on " + label
                            + " did not finish within " + timeout.toMillis() + "ms");
                }
                Integer exitStatus = channel.getExitStatus();
                if (exitStatus != null && exitStatus != 0) {
                    throw new ProbeException(ProbeErrorType.MALFORMED_RESPONSE, "'" + command + "' on " + label
                            + " exited with " + exitStatus + ": " + err.toString(StandardCharsets.UTF_8).trim());
                }
                return out.toString(StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ProbeException(ProbeErrorType.UNREACHABLE,
                        "SSH command '" + command + "' on " + label + " failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            closeQuietly(session, label);
            client.stop();
        }
    }

    /**
     * Accepts the host key matching the configured fingerprint, or any key
     * when none is configured.
     */
    static final class HostKeyVerifier implements ServerKeyVerifier {

        private final String expectedFingerprint;
        private final String label;
        private volatile boolean rejected;

        HostKeyVerifier(String expectedFingerprint, String label) {
            this.expectedFingerprint = expectedFingerprint == null || expectedFingerprint.isBlank()
                    ? null : expectedFingerprint.trim();
            this.label = label;
        }

        @Override
        public boolean verifyServerKey(ClientSession clientSession, SocketAddress remoteAddress, PublicKey serverKey) {
            var fingerprint = KeyUtils.getFingerPrint(serverKey);
            if (expectedFingerprint == null) {
                log.debug("Accepting unpinned SSH host key {} from {}", fingerprint, label);
                return true;
            }
            if (expectedFingerprint.equals(fingerprint)) {
                return true;
            }
            rejected = true;
            log.warn("Rejecting SSH host key {} from {}, expected {}", fingerprint, label, expectedFingerprint);
            return false;
        }

        boolean isRejected() {
            return rejected;
        }
    }
}
