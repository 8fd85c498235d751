package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskFilter {
    private TaskStatus status;
    private AgentType type;
    @Builder.Default
    private int limit = 50;
    @Builder.Default
    private int offset = 0;

    public boolean matches(TaskView task) {
        return (status == null || status == task.getStatus())
            && (type == null || type == task.getType());
    }
}
