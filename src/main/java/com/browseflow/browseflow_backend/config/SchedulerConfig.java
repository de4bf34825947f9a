package com.browseflow.browseflow_backend.config;

import com.browseflow.browseflow_backend.engine.ExecutionEventPublisher;
import com.browseflow.browseflow_backend.engine.WorkflowExecutorFactory;
import com.browseflow.browseflow_backend.service.BatchPersistenceService;
import com.browseflow.browseflow_backend.service.ExecutionManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread pools and the scheduler. Execution threads are unbounded: admission is
 * decided by {@link ExecutionManager}'s worker slots, not by the pool.
 */
@Configuration
public class SchedulerConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService executionThreads() {
        return Executors.newCachedThreadPool(threadFactory("execution-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService waitConditionExecutor() {
        return Executors.newCachedThreadPool(threadFactory("wait-check-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService cleanupScheduler() {
        return Executors.newSingleThreadScheduledExecutor(threadFactory("execution-cleanup-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutionManager executionManager(
            @Value("${browseflow.execution.max-workers:4}") int maxWorkers,
            @Value("${browseflow.execution.cleanup-delay-ms:5000}") long cleanupDelayMs,
            @Value("${browseflow.execution.default-output-path:./output}") String defaultOutputPath,
            WorkflowExecutorFactory executorFactory,
            BatchPersistenceService persistence,
            ExecutionEventPublisher eventPublisher,
            @Qualifier("executionThreads") ExecutorService executionThreads,
            @Qualifier("cleanupScheduler") ScheduledExecutorService cleanupScheduler) {
        return new ExecutionManager(maxWorkers, cleanupDelayMs, defaultOutputPath, executorFactory,
                persistence, eventPublisher, executionThreads, cleanupScheduler);
    }

    private static CustomizableThreadFactory threadFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
