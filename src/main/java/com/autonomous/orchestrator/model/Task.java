package com.autonomous.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Mutable task record owned by the engine. Callers outside the engine only ever see
 * {@link TaskView} snapshots. All mutation happens while holding this object's monitor.
 */
@Data
@NoArgsConstructor
public class Task {
    private String id;
    private AgentType type;
    private String title;
    private String prompt;
    private volatile TaskStatus status;
    private int progress;
    private Instant createdAt;
    private Instant updatedAt;
    private double cost;
    private int attempts;
    private String model;
    private String result;
    private Verdict verdict;
    private String verificationFeedback;
    private String error;

    public static Task pending(String id, TaskSpec spec) {
        Task task = new Task();
        task.setId(id);
        task.setType(spec.getType());
        task.setTitle(spec.getTitle());
        task.setPrompt(spec.getPrompt());
        task.setStatus(TaskStatus.PENDING);
        task.setCreatedAt(Instant.now());
        task.setUpdatedAt(task.getCreatedAt());
        return task;
    }

    public synchronized int incrementAttempts() {
        attempts++;
        updatedAt = Instant.now();
        return attempts;
    }

    public synchronized void addCost(double amount) {
        cost += amount;
        updatedAt = Instant.now();
    }

    public synchronized TaskView toView() {
        return TaskView.builder()
            .id(id)
            .type(type)
            .title(title)
            .prompt(prompt)
            .status(status)
            .progress(progress)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .cost(cost)
            .attempts(attempts)
            .model(model)
            .result(result)
            .verdict(verdict)
            .verificationFeedback(verificationFeedback)
            .error(error)
            .build();
    }
}
