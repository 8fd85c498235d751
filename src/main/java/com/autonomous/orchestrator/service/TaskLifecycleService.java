package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskEvent;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Applies a transition, persists the task and publishes a {@link TaskEvent}.
 * The single place tasks are mutated after submission.
 */
@Slf4j
@Component
public class TaskLifecycleService {

    private final TaskStateMachine stateMachine;
    private final TaskRepository repository;
    private final ApplicationEventPublisher events;

    public TaskLifecycleService(TaskStateMachine stateMachine, TaskRepository repository,
                                ApplicationEventPublisher events) {
        this.stateMachine = stateMachine;
        this.repository = repository;
        this.events = events;
    }

    public TaskStateMachine getStateMachine() {
        return stateMachine;
    }

    /**
     * Transitions unconditionally; an illegal edge throws.
     */
    public TaskStatus move(Task task, TaskStatus to, Consumer<Task> update) {
        TaskStatus previous;
        synchronized (task) {
            previous = stateMachine.transition(task, to);
            if (update != null) {
                update.accept(task);
            }
        }
        committed(task, previous);
        return previous;
    }

    /**
     * Transitions a task a worker is executing. Returns false, leaving the task untouched,
     * when a cancel got there first.
     */
    public boolean advance(Task task, TaskStatus to, Consumer<Task> update) {
        TaskStatus previous;
        synchronized (task) {
            if (task.getStatus() == TaskStatus.CANCELLED) {
                return false;
            }
            previous = stateMachine.transition(task, to);
            if (update != null) {
                update.accept(task);
            }
        }
        committed(task, previous);
        return true;
    }

    /**
     * Persists and announces a transition that was already applied.
     */
    public void committed(Task task, TaskStatus previous) {
        save(task);
        try {
            events.publishEvent(new TaskEvent(task.toView(), previous));
        } catch (RuntimeException e) {
            log.error("Task event listener failed. taskId={}, status={}, error={}",
                task.getId(), task.getStatus(), e.getMessage(), e);
        }
    }

    public void save(Task task) {
        try {
            repository.save(task);
        } catch (RuntimeException e) {
            // in-memory state stays authoritative; the next transition writes again
            log.error("Failed to persist task. taskId={}, status={}, error={}",
                task.getId(), task.getStatus(), e.getMessage(), e);
        }
    }
}
