package com.autonomous.orchestrator.exception;

public class TaskValidationException extends OrchestratorException {

    public TaskValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
