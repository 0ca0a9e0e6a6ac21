package com.topology.core.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for probe tasks and background exports.
 *
 * Probe tasks are blocking network I/O, so the probe pool is sized well above
 * the core count; per-round concurrency is bounded separately by the coordinator.
 */
@Slf4j
@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

    private static final int PROBE_POOL_HEADROOM = 4;

    private final DiscoveryConfig discoveryConfig;

    // ==================== Executor Beans ====================

    /**
     * Executor that runs (target, probe) tasks. Needs future cancellation,
     * so it is exposed as an {@link ExecutorService}.
     */
    @Bean(name = "probeExecutor", destroyMethod = "shutdownNow")
    public ExecutorService probeExecutor() {
        int poolSize = discoveryConfig.getRound().getMaxConcurrency()
                * Math.max(1, discoveryConfig.getWorker().getThreadCount())
                + PROBE_POOL_HEADROOM;
        log.info("Initializing probe executor with {} platform threads", poolSize);
        return Executors.newFixedThreadPool(poolSize, namedDaemonThreads("probe-"));
    }

    /**
     * Executor for single probe attempts. The pair task waits on each attempt
     * with the per-probe timeout and abandons it on expiry, so an attempt
     * stuck in blocking I/O never holds a pair thread past its timeout.
     */
    @Bean(name = "probeAttemptExecutor", destroyMethod = "shutdownNow")
    public ExecutorService probeAttemptExecutor() {
        log.info("Initializing probe attempt executor with cached platform threads");
        return Executors.newCachedThreadPool(namedDaemonThreads("probe-attempt-"));
    }

    /**
     * Executor for export operations (Neo4j push).
     */
    @Bean(name = "exportExecutor")
    public Executor exportExecutor() {
        log.info("Initializing export executor with platform thread pool");
        return createPlatformThreadPool("export-", 1, 2, 50);
    }

    /**
     * Single thread for change-stream sends, which keeps events in order per
     * subscriber.
     */
    @Bean(name = "eventStreamExecutor")
    public Executor eventStreamExecutor() {
        log.info("Initializing event stream executor with platform thread pool");
        return createPlatformThreadPool("change-stream-", 1, 1, 1000);
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                            int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable);
            thread.setName(prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
