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
public class KnowledgeRecord {
    private String id;
    private String embeddingRef;
    private String text;
    private String taskId;
    private AgentType agentType;
    private Instant createdAt;
}
