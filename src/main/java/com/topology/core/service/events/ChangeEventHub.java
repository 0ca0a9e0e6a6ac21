package com.topology.core.service.events;

import com.topology.core.service.config.TopologyConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans topology change events out to server-sent event subscribers and keeps
 * a short backlog for polling clients.
 *
 * Sends run on the single-threaded stream executor, so a slow subscriber
 * delays other subscribers but never the thread publishing the change.
 */
@Slf4j
@Component
public class ChangeEventHub {

    static final int BACKLOG_SIZE = 500;

    private final TopologyConfig topologyConfig;
    private final Executor streamExecutor;

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final Deque<TopologyChangeEvent> backlog = new ArrayDeque<>();

    public ChangeEventHub(TopologyConfig topologyConfig,
                         @Qualifier("eventStreamExecutor") Executor streamExecutor) {
        this.topologyConfig = topologyConfig;
        this.streamExecutor = streamExecutor;
    }

    public SseEmitter subscribe() {
        return register(new SseEmitter(0L));
    }

    SseEmitter register(SseEmitter emitter) {
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));

        var ping = Map.of("ts", Instant.now().toString());
        dispatch(() -> send(emitter, "PING", ping), "PING");
        log.debug("Change stream subscriber added, {} active", emitters.size());
        return emitter;
    }

    @EventListener
    public void onChange(TopologyChangeEvent event) {
        synchronized (backlog) {
            backlog.addLast(event);
            while (backlog.size() > BACKLOG_SIZE) {
                backlog.removeFirst();
            }
        }
        if (!topologyConfig.getFeatures().isEventStreamEnabled() || emitters.isEmpty()) {
            return;
        }
        dispatch(() -> {
            for (var emitter : emitters) {
                send(emitter, event.type().name(), event);
            }
        }, event.type() + " v" + event.version());
    }

    /**
     * Backlog events newer than {@code afterVersion}, oldest first.
     */
    public List<TopologyChangeEvent> recent(long afterVersion, int limit) {
        synchronized (backlog) {
            var matching = backlog.stream()
                    .filter(event -> event.version() > afterVersion)
                    .toList();
            int from = Math.max(0, matching.size() - Math.max(0, limit));
            return List.copyOf(matching.subList(from, matching.size()));
        }
    }

    public int subscriberCount() {
        return emitters.size();
    }

    private void dispatch(Runnable sends, String what) {
        try {
            streamExecutor.execute(sends);
        } catch (RejectedExecutionException e) {
            log.warn("Change stream backlogged, dropping {} for live subscribers", what);
        }
    }

    private void send(SseEmitter emitter, String name, Object payload) {
        try {
            emitter.send(SseEmitter.event().name(name).data(payload, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping change stream subscriber: {}", e.getMessage());
            emitters.remove(emitter);
        }
    }
}
