package com.autonomous.orchestrator.exception;

public class DuplicateTaskException extends OrchestratorException {

    public DuplicateTaskException(String taskId) {
        super("DUPLICATE_TASK", "Task id already in use: " + taskId);
    }
}
