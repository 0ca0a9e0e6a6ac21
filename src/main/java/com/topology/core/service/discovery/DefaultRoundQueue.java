package com.topology.core.service.discovery;

import com.topology.core.service.config.DiscoveryConfig;
import com.topology.core.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of RoundQueue using a bounded BlockingQueue.
 *
 * Rejecting offers once full is the backpressure signal surfaced to callers.
 * A round identical to one still waiting is merged into it rather than
 * queued twice, so repeated submissions of the same work do not fill the
 * queue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultRoundQueue implements RoundQueue {

    private final DiscoveryConfig config;
    private final MetricsConfig metricsConfig;

    private final Map<RoundWorkItem.RoundScope, String> waiting = new ConcurrentHashMap<>();
    private final Object offerLock = new Object();

    private BlockingQueue<RoundWorkItem> queue;
    private int capacity;

    @PostConstruct
    void init() {
        this.capacity = config.getQueue().getCapacity();
        this.queue = new LinkedBlockingQueue<>(capacity);

        metricsConfig.registerQueueGauge(
                "topology.discovery.queue.size",
                "Current discovery round queue size",
                this::size
        );
        metricsConfig.registerQueueGauge(
                "topology.discovery.queue.utilization",
                "Discovery round queue utilization percentage",
                this::getUtilizationPercent
        );

        log.info("RoundQueue initialized with capacity: {}", capacity);
    }

    @Override
    public Admission offer(RoundWorkItem item, long timeoutMs) {
        var scope = item.scope();
        synchronized (offerLock) {
            String existing = waiting.get(scope);
            if (existing != null) {
                metricsConfig.getRoundsCoalesced().increment();
                log.info("Round {} coalesced into waiting round {}", item.getRoundId(), existing);
                return Admission.coalesced(existing);
            }
            waiting.put(scope, item.getRoundId());
            try {
                if (queue.offer(item, timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.debug("Enqueued round: {}", item.getRoundId());
                    return Admission.queued(item.getRoundId());
                }
                log.warn("Queue full, rejecting round: {}", item.getRoundId());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while enqueuing round: {}", item.getRoundId(), e);
            }
            waiting.remove(scope, item.getRoundId());
            return Admission.rejected(item.getRoundId());
        }
    }

    @Override
    public Optional<RoundWorkItem> dequeue(long timeoutMs) {
        try {
            RoundWorkItem item = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (item != null) {
                waiting.remove(item.scope(), item.getRoundId());
                log.debug("Dequeued round: {}", item.getRoundId());
            }
            return Optional.ofNullable(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while dequeuing round");
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public void clear() {
        synchronized (offerLock) {
            queue.clear();
            waiting.clear();
        }
        log.info("Round queue cleared");
    }
}
