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
public class CostEntry {
    private Instant timestamp;
    private String taskId;
    private AgentType agentType;
    private String model;
    private long tokensUsed;
    private double costUsd;
    private CostOperation operation;
}
