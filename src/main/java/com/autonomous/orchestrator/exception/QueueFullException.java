package com.autonomous.orchestrator.exception;

public class QueueFullException extends OrchestratorException {

    public QueueFullException(int capacity) {
        super("QUEUE_FULL", "Task queue is full (capacity " + capacity + ")");
    }
}
