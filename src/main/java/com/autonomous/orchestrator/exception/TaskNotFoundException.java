package com.autonomous.orchestrator.exception;

public class TaskNotFoundException extends OrchestratorException {

    public TaskNotFoundException(String taskId) {
        super("TASK_NOT_FOUND", "Task not found: " + taskId);
    }
}
