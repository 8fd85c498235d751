package com.autonomous.orchestrator.model;

public enum TaskStatus {
    PENDING,
    QUEUED,
    RUNNING,
    AWAITING_VERIFICATION,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
