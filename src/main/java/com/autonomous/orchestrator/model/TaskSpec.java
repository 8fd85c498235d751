package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Submission request for a new task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSpec {
    private AgentType type;
    private String title;
    private String prompt;
}
