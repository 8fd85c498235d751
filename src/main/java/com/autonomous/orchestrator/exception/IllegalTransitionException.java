package com.autonomous.orchestrator.exception;

import com.autonomous.orchestrator.model.TaskStatus;

public class IllegalTransitionException extends OrchestratorException {

    public IllegalTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("ILLEGAL_TRANSITION", String.format("Task %s cannot move from %s to %s", taskId, from, to));
    }
}
