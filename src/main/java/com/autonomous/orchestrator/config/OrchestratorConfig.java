package com.autonomous.orchestrator.config;

import com.autonomous.orchestrator.exception.ProviderException;
import com.autonomous.orchestrator.service.InMemoryTaskRepository;
import com.autonomous.orchestrator.service.JsonFileTaskRepository;
import com.autonomous.orchestrator.service.TaskRepository;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class OrchestratorConfig {

    /**
     * Worker pool sized to the parallelism cap. The scheduler never hands it more
     * than {@code max-parallel-tasks} tasks at once.
     */
    @Bean(name = "taskWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService taskWorkerPool(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(properties.getMaxParallelTasks(), 1),
            namedThreadFactory("task-worker-"));
    }

    /**
     * Model calls run here so the worker can enforce the per-call timeout and
     * interrupt the call on cancellation.
     */
    @Bean(name = "modelIoExecutor", destroyMethod = "shutdownNow")
    public ExecutorService modelIoExecutor() {
        return Executors.newCachedThreadPool(namedThreadFactory("model-io-"));
    }

    @Bean
    public Retry modelRetry(OrchestratorProperties properties) {
        return Retry.of("model", modelRetryConfig(properties));
    }

    @Bean
    public TimeLimiter modelTimeLimiter(OrchestratorProperties properties) {
        return TimeLimiter.of("model", TimeLimiterConfig.custom()
            .timeoutDuration(properties.getTaskTimeout())
            .cancelRunningFuture(true)
            .build());
    }

    @Bean
    public TaskRepository taskRepository(OrchestratorProperties properties) {
        if (properties.isPersistenceEnabled()) {
            log.info("Persisting tasks under {}", properties.getDataPath());
            return new JsonFileTaskRepository(properties.getDataPath());
        }
        log.info("Task persistence disabled, keeping tasks in memory");
        return new InMemoryTaskRepository();
    }

    public static RetryConfig modelRetryConfig(OrchestratorProperties properties) {
        return RetryConfig.custom()
            .maxAttempts(Math.max(properties.getMaxAttempts(), 1))
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                Math.max(properties.getRetryBackoff().toMillis(), 1L),
                properties.getRetryBackoffMultiplier()))
            .retryExceptions(ProviderException.class)
            .build();
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger index = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
