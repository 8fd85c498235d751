package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TaskView {
    String id;
    AgentType type;
    String title;
    String prompt;
    TaskStatus status;
    int progress;
    Instant createdAt;
    Instant updatedAt;
    double cost;
    int attempts;
    String model;
    String result;
    Verdict verdict;
    String verificationFeedback;
    String error;
}
