package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.IllegalTransitionException;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.autonomous.orchestrator.model.TaskStatus.*;

/**
 * Legal task lifecycle edges. Terminal states have no outgoing edges.
 */
@Slf4j
@Component
public class TaskStateMachine {

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(QUEUED, CANCELLED));
        TRANSITIONS.put(QUEUED, EnumSet.of(RUNNING, CANCELLED));
        TRANSITIONS.put(RUNNING, EnumSet.of(AWAITING_VERIFICATION, FAILED, CANCELLED));
        TRANSITIONS.put(AWAITING_VERIFICATION, EnumSet.of(COMPLETED, RUNNING, FAILED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(TaskStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(TaskStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(TaskStatus.class));
    }

    public boolean canTransition(TaskStatus from, TaskStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Moves the task to {@code to} and returns the previous status.
     *
     * @throws IllegalTransitionException when the edge is not in the table
     */
    public TaskStatus transition(Task task, TaskStatus to) {
        synchronized (task) {
            TaskStatus from = task.getStatus();
            if (!canTransition(from, to)) {
                IllegalTransitionException ex = new IllegalTransitionException(task.getId(), from, to);
                log.error("Rejected task transition. taskId={}, from={}, to={}", task.getId(), from, to);
                throw ex;
            }
            task.setStatus(to);
            task.setUpdatedAt(Instant.now());
            log.debug("Task transition. taskId={}, from={}, to={}", task.getId(), from, to);
            return from;
        }
    }
}
