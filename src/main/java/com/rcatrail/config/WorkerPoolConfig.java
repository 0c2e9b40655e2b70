package com.rcatrail.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for per-scenario computations.
 *
 * Scenarios are independent, so one batch fans out one task per scenario.
 * Each task works on its own slice of events; nothing is shared between tasks.
 *
 * AbortPolicy: when the queue is saturated the batch fails fast and the
 * orchestration layer retries it, instead of running work on the caller thread.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WorkerPoolConfig {

    private final RcaTrailProperties properties;

    @Bean("scenarioWorkerExecutor")
    public Executor scenarioWorkerExecutor() {
        RcaTrailProperties.Workers workers = properties.getWorkers();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers.getCorePoolSize());
        executor.setMaxPoolSize(workers.getMaxPoolSize());
        executor.setQueueCapacity(workers.getQueueCapacity());
        executor.setThreadNamePrefix("scenario-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy() {
            @Override
            public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                log.warn("Scenario task rejected, queue saturated: active={}, poolSize={}, queueSize={}",
                        e.getActiveCount(), e.getPoolSize(), e.getQueue().size());
                super.rejectedExecution(r, e);
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Scenario worker pool ready: core={}, max={}, queue={}",
                workers.getCorePoolSize(), workers.getMaxPoolSize(), workers.getQueueCapacity());
        return executor;
    }
}
