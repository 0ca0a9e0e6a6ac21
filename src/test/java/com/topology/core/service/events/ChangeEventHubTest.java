package com.topology.core.service.events;

import com.topology.core.service.config.TopologyConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ChangeEventHubTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private TopologyConfig topologyConfig;
    private ChangeEventHub hub;

    @BeforeEach
    void setUp() {
        topologyConfig = new TopologyConfig();
        hub = new ChangeEventHub(topologyConfig, Runnable::run);
    }

    @Test
    void returnsEventsAfterVersionOldestFirst() {
        hub.onChange(event("mac:aa:bb:cc:dd:ee:ff", 1));
        hub.onChange(event("mac:11:22:33:44:55:66", 2));
        hub.onChange(event("mac:de:ad:be:ef:00:01", 3));

        assertThat(hub.recent(1, 10)).extracting(TopologyChangeEvent::version).containsExactly(2L, 3L);
        assertThat(hub.recent(0, 1)).extracting(TopologyChangeEvent::subject)
                .containsExactly("mac:de:ad:be:ef:00:01");
        assertThat(hub.recent(3, 10)).isEmpty();
    }

    @Test
    void keepsBoundedBacklog() {
        for (int i = 1; i <= ChangeEventHub.BACKLOG_SIZE + 20; i++) {
            hub.onChange(event("device-" + i, i));
        }

        var backlog = hub.recent(0, Integer.MAX_VALUE);
        assertThat(backlog).hasSize(ChangeEventHub.BACKLOG_SIZE);
        assertThat(backlog.get(0).version()).isEqualTo(21L);
    }

    @Test
    void keepsBacklogWhenStreamingDisabled() {
        topologyConfig.getFeatures().setEventStreamEnabled(false);

        hub.onChange(event("mac:aa:bb:cc:dd:ee:ff", 1));

        assertThat(hub.recent(0, 10)).hasSize(1);
    }

    @Test
    void tracksSubscribers() {
        hub.subscribe();
        hub.subscribe();

        assertThat(hub.subscriberCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("A subscriber stuck in send does not block the publishing thread")
    void stalledSubscriberDoesNotBlockPublisher() throws Exception {
        var executor = Executors.newSingleThreadExecutor();
        var asyncHub = new ChangeEventHub(topologyConfig, executor);
        var stalled = new StalledEmitter();
        var healthy = new RecordingEmitter();
        try {
            asyncHub.register(stalled);
            asyncHub.register(healthy);
            assertThat(stalled.entered.await(2, TimeUnit.SECONDS)).isTrue();

            long start = System.nanoTime();
            asyncHub.onChange(event("mac:aa:bb:cc:dd:ee:ff", 1));
            asyncHub.onChange(event("mac:11:22:33:44:55:66", 2));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(elapsedMillis).isLessThan(500);
            assertThat(asyncHub.recent(0, 10)).hasSize(2);

            stalled.release.countDown();
            await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
                    assertThat(healthy.names).containsExactly("PING", "DEVICE_ADDED", "DEVICE_ADDED"));
        } finally {
            stalled.release.countDown();
            executor.shutdownNow();
        }
    }

    private static TopologyChangeEvent event(String subject, long version) {
        return new TopologyChangeEvent(ChangeType.DEVICE_ADDED, subject, null, null, version, NOW);
    }

    /**
     * Emitter whose first send blocks until released.
     */
    private static final class StalledEmitter extends SseEmitter {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        StalledEmitter() {
            super(0L);
        }

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final class RecordingEmitter extends SseEmitter {

        private final List<String> names = new CopyOnWriteArrayList<>();

        RecordingEmitter() {
            super(0L);
        }

        @Override
        public void send(SseEventBuilder builder) {
            builder.build().stream()
                    .map(part -> String.valueOf(part.getData()))
                    .filter(data -> data.startsWith("event:"))
                    .map(data -> data.substring("event:".length(), data.indexOf('\n')))
                    .forEach(names::add);
        }
    }
}
