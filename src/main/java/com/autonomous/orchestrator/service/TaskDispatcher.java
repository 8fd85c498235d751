package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.QueueFullException;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO admission control.
 * <p>
 * One dispatch thread takes the head of the queue whenever a slot is free and the cost ledger
 * admits it, then hands the task to the worker pool. Slots are released when a worker returns,
 * whatever the outcome. The queue, the running count and the handles are guarded by {@code lock};
 * lock order is scheduler, then ledger, then task.
 */
@Slf4j
@Service
public class TaskDispatcher {

    private final TaskExecutionService executionService;
    private final TaskLifecycleService lifecycle;
    private final CostLedger ledger;
    private final ExecutorService workerPool;
    private final int maxParallel;
    private final int queueCapacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final Deque<Task> queue = new ArrayDeque<>();
    private final Map<String, TaskHandle> running = new ConcurrentHashMap<>();
    private int runningCount;

    private volatile boolean active;
    private Thread dispatchThread;

    public TaskDispatcher(TaskExecutionService executionService, TaskLifecycleService lifecycle, CostLedger ledger,
                         @Qualifier("taskWorkerPool") ExecutorService workerPool,
                         OrchestratorProperties properties) {
        this.executionService = executionService;
        this.lifecycle = lifecycle;
        this.ledger = ledger;
        this.workerPool = workerPool;
        this.maxParallel = Math.max(properties.getMaxParallelTasks(), 1);
        this.queueCapacity = Math.max(properties.getQueueCapacity(), 0);
    }

    public synchronized void start() {
        if (active) {
            return;
        }
        active = true;
        dispatchThread = new Thread(this::dispatchLoop, "task-dispatcher");
        dispatchThread.setDaemon(true);
        dispatchThread.start();
        log.info("Task dispatcher started. maxParallel={}, queueCapacity={}", maxParallel,
            queueCapacity == 0 ? "unbounded" : queueCapacity);
    }

    public synchronized void stop() {
        if (!active) {
            return;
        }
        active = false;
        signal();
        dispatchThread.interrupt();
        try {
            dispatchThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Task dispatcher stopped. queued={}, running={}", queuedCount(), runningCount());
    }

    /**
     * Admits a pending task to the tail of the queue.
     *
     * @throws QueueFullException when a bounded queue is at capacity
     */
    public void enqueue(Task task) {
        lock.lock();
        try {
            if (queueCapacity > 0 && queue.size() >= queueCapacity) {
                throw new QueueFullException(queueCapacity);
            }
            lifecycle.move(task, TaskStatus.QUEUED, t -> t.setProgress(0));
            queue.addLast(task);
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Task queued. taskId={}, type={}", task.getId(), task.getType());
    }

    /**
     * Puts a task that is already QUEUED (restored from storage) back in line.
     */
    public void restore(Task task) {
        if (task.getStatus() != TaskStatus.QUEUED) {
            throw new IllegalStateException("Only queued tasks can be restored, got " + task.getStatus());
        }
        lock.lock();
        try {
            queue.addLast(task);
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels a queued or executing task. Queued tasks leave the queue at once; an executing
     * task's in-flight model call is interrupted and its slot frees when the worker unwinds.
     *
     * @return false if the task had already finished
     */
    public boolean cancel(Task task) {
        TaskHandle handle;
        TaskStatus previous;
        lock.lock();
        try {
            synchronized (task) {
                if (task.getStatus().isTerminal()) {
                    return false;
                }
                queue.remove(task);
                previous = lifecycle.getStateMachine().transition(task, TaskStatus.CANCELLED);
                task.setError("Cancelled by request");
            }
            handle = running.get(task.getId());
        } finally {
            lock.unlock();
        }
        lifecycle.committed(task, previous);
        if (handle != null) {
            handle.cancel();
        }
        log.info("Task cancelled. taskId={}, previousStatus={}", task.getId(), previous);
        return true;
    }

    /**
     * Re-evaluates dispatch, e.g. after the cost ledger was confirmed.
     */
    public void signal() {
        lock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int runningCount() {
        lock.lock();
        try {
            return runningCount;
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public List<String> queuedTaskIds() {
        lock.lock();
        try {
            List<String> ids = new ArrayList<>(queue.size());
            for (Task task : queue) {
                ids.add(task.getId());
            }
            return ids;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    private void dispatchLoop() {
        while (active) {
            TaskHandle next;
            lock.lock();
            try {
                next = awaitNext();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                lock.unlock();
            }
            if (next == null) {
                return;
            }
            launch(next);
        }
    }

    // caller holds lock
    private TaskHandle awaitNext() throws InterruptedException {
        while (active) {
            Task head = queue.peekFirst();
            if (head != null && runningCount < maxParallel
                && ledger.tryAdmit(() -> lifecycle.getStateMachine().transition(head, TaskStatus.RUNNING))) {
                queue.pollFirst();
                runningCount++;
                TaskHandle handle = new TaskHandle(head);
                running.put(head.getId(), handle);
                return handle;
            }
            if (head != null && runningCount < maxParallel) {
                log.debug("Dispatch held, cost ledger paused. queued={}", queue.size());
            }
            wakeUp.await();
        }
        return null;
    }

    private void launch(TaskHandle handle) {
        Task task = handle.getTask();
        synchronized (task) {
            task.setProgress(20);
        }
        lifecycle.committed(task, TaskStatus.QUEUED);
        log.debug("Task dispatched. taskId={}, type={}", task.getId(), task.getType());
        try {
            workerPool.execute(() -> runWorker(handle));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected task. taskId={}, error={}", task.getId(), e.getMessage());
            lifecycle.advance(task, TaskStatus.FAILED, t -> t.setError("Worker pool unavailable"));
            release(handle);
        }
    }

    private void runWorker(TaskHandle handle) {
        try {
            executionService.execute(handle);
        } catch (RuntimeException e) {
            log.error("Task worker terminated abnormally. taskId={}, status={}, error={}",
                handle.getTask().getId(), handle.getTask().getStatus(), e.getMessage(), e);
        } finally {
            release(handle);
        }
    }

    private void release(TaskHandle handle) {
        lock.lock();
        try {
            if (running.remove(handle.getTask().getId()) != null) {
                runningCount--;
            }
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
