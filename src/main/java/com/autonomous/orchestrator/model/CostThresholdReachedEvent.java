package com.autonomous.orchestrator.model;

import lombok.Value;

@Value
public class CostThresholdReachedEvent {
    double totalCost;
    double pausedAt;
}
