package com.autonomous.orchestrator.model;

import lombok.Value;

/**
 * Published after every committed task transition.
 */
@Value
public class TaskEvent {
    TaskView task;
    TaskStatus previousStatus;

    public TaskStatus getStatus() {
        return task.getStatus();
    }
}
