package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostHistoryFilter {
    private String taskId;
    private AgentType agentType;
    // inclusive lower bound, exclusive upper bound
    private Instant from;
    private Instant to;
    @Builder.Default
    private int limit = 50;

    public boolean matches(CostEntry entry) {
        return (taskId == null || taskId.equals(entry.getTaskId()))
            && (agentType == null || agentType == entry.getAgentType())
            && (from == null || !entry.getTimestamp().isBefore(from))
            && (to == null || entry.getTimestamp().isBefore(to));
    }
}
