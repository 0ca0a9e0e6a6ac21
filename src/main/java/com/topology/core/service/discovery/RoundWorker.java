package com.topology.core.service.discovery;

import com.topology.core.service.config.DiscoveryConfig;
import com.topology.core.service.engine.GraphInvariantViolationException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker service that takes rounds off the round queue and executes them.
 *
 * Workers spend most of their time blocked on the queue poll; probe work
 * itself runs on the probe executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundWorker {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final RoundQueue queue;
    private final DiscoveryService discoveryService;
    private final DiscoveryConfig discoveryConfig;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger(0);
    private final AtomicInteger threadCounter = new AtomicInteger(0);

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        int workerCount = Math.max(1, discoveryConfig.getWorker().getThreadCount());
        executorService = Executors.newFixedThreadPool(workerCount, this::createPlatformThread);
        running.set(true);
        for (int i = 0; i < workerCount; i++) {
            executorService.submit(this::processLoop);
        }
        log.info("RoundWorker started with {} platform thread workers", workerCount);
    }

    @PreDestroy
    void stop() {
        running.set(false);
        shutdownExecutor();
        log.info("RoundWorker stopped. Final active workers: {}", activeWorkers.get());
    }

    private Thread createPlatformThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("round-worker-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    private void shutdownExecutor() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of round workers");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    // ==================== Processing Loop ====================

    private void processLoop() {
        activeWorkers.incrementAndGet();
        var pollTimeoutMs = discoveryConfig.getWorker().getPollMs();

        try {
            while (running.get()) {
                processNextItem(pollTimeoutMs);
            }
        } finally {
            activeWorkers.decrementAndGet();
        }
    }

    private void processNextItem(long pollTimeoutMs) {
        try {
            queue.dequeue(pollTimeoutMs)
                    .ifPresent(this::processWorkItem);
        } catch (Exception e) {
            log.error("Error in round worker loop", e);
        }
    }

    // ==================== Work Item Dispatch ====================

    private void processWorkItem(RoundWorkItem item) {
        try {
            var execution = discoveryService.execute(item);
            log.debug("Round {} done, committed: {}", item.getRoundId(), execution.committed());
        } catch (DiscoveryException e) {
            log.error("Round failed for {}: {} [{}]", item.getRoundId(), e.getMessage(), e.getErrorCode());
        } catch (GraphInvariantViolationException e) {
            log.error("Commit rejected for {}: {}", item.getRoundId(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error processing round: {}", item.getRoundId(), e);
        }
    }

    // ==================== Monitoring ====================

    /**
     * Returns the current number of active workers.
     */
    public int getActiveWorkerCount() {
        return activeWorkers.get();
    }
}
