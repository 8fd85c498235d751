package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CostSummary {
    double totalCost;
    long totalTokens;
    double costLimit;
    double nextPauseAt;
    Map<String, Double> costByModel;
    Map<String, Double> costByAgent;
    Map<String, Double> costByOperation;
    boolean approachingLimit;
    boolean paused;
    LedgerStatus status;
}
