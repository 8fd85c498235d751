package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class SystemStatus {
    Map<TaskStatus, Long> tasksByStatus;
    int runningTasks;
    int queuedTasks;
    int maxParallelTasks;
    CostSummary costs;
    Map<AgentType, String> agents;
}
