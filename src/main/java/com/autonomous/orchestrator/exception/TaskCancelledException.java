package com.autonomous.orchestrator.exception;

/**
 * Raised inside a worker when its task was cancelled while a call was in flight.
 */
public class TaskCancelledException extends OrchestratorException {

    public TaskCancelledException(String taskId) {
        super("TASK_CANCELLED", "Task cancelled: " + taskId);
    }
}
