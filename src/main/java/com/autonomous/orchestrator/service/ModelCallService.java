package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.ProviderException;
import com.autonomous.orchestrator.exception.TaskCancelledException;
import com.autonomous.orchestrator.model.ModelResponse;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Calls the {@link ModelInvoker} on the I/O executor under a time limit, retrying provider
 * failures with exponential backoff.
 */
@Slf4j
@Service
public class ModelCallService {

    private final ModelInvoker invoker;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService ioExecutor;

    public ModelCallService(ModelInvoker invoker, Retry modelRetry, TimeLimiter modelTimeLimiter,
                            @Qualifier("modelIoExecutor") ExecutorService ioExecutor) {
        this.invoker = invoker;
        this.retry = modelRetry;
        this.timeLimiter = modelTimeLimiter;
        this.ioExecutor = ioExecutor;
        this.retry.getEventPublisher().onRetry(event ->
            log.warn("Retrying model call. attempt={}, wait={}ms, error={}",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));
    }

    /**
     * @param beforeAttempt runs before every attempt, retries included
     * @throws ProviderException once the attempt budget is spent
     * @throws TaskCancelledException when the handle is cancelled mid-call
     */
    public ModelResponse call(String prompt, String model, int maxTokens, TaskHandle handle, Runnable beforeAttempt) {
        try {
            return retry.executeCallable(() -> attempt(prompt, model, maxTokens, handle, beforeAttempt));
        } catch (ProviderException | TaskCancelledException e) {
            if (handle.isCancelled()) {
                throw new TaskCancelledException(handle.getTask().getId());
            }
            throw e;
        } catch (Exception e) {
            if (handle.isCancelled()) {
                throw new TaskCancelledException(handle.getTask().getId());
            }
            throw new ProviderException("Model call failed: " + e.getMessage(), e);
        }
    }

    private ModelResponse attempt(String prompt, String model, int maxTokens, TaskHandle handle,
                                  Runnable beforeAttempt) {
        handle.throwIfCancelled();
        beforeAttempt.run();
        try {
            return timeLimiter.executeFutureSupplier(() ->
                handle.track(ioExecutor.submit(() -> invoker.invoke(prompt, model, maxTokens))));
        } catch (TimeoutException e) {
            throw new ProviderException("Model call timed out after "
                + timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException(handle.getTask().getId());
        } catch (CancellationException e) {
            throw new TaskCancelledException(handle.getTask().getId());
        } catch (ProviderException | TaskCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            // not a provider failure, so not retried
            if (handle.isCancelled()) {
                throw new TaskCancelledException(handle.getTask().getId());
            }
            throw e;
        } catch (Exception e) {
            if (handle.isCancelled()) {
                throw new TaskCancelledException(handle.getTask().getId());
            }
            throw new ProviderException("Model call failed: " + e.getMessage(), e);
        }
    }
}
