package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.TaskCancelledException;
import com.autonomous.orchestrator.model.Task;
import lombok.Getter;

import java.util.concurrent.Future;

/**
 * Cancellation link between the scheduler and the worker executing one task.
 */
public class TaskHandle {

    @Getter
    private final Task task;
    private volatile boolean cancelled;
    private volatile Future<?> inFlight;

    public TaskHandle(Task task) {
        this.task = task;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new TaskCancelledException(task.getId());
        }
    }

    /**
     * Registers the current model call so a cancel can interrupt it.
     */
    <F extends Future<?>> F track(F call) {
        this.inFlight = call;
        if (cancelled) {
            call.cancel(true);
        }
        return call;
    }

    /**
     * Marks the handle cancelled and interrupts the in-flight call. The worker itself is left
     * to unwind so its slot is always released.
     */
    void cancel() {
        cancelled = true;
        Future<?> call = inFlight;
        if (call != null) {
            call.cancel(true);
        }
    }
}
