package com.autonomous.orchestrator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Profile of one agent kind, loaded from YAML at startup.
 */
@Data
public class AgentDescriptor {
    private AgentType type;
    private String name;
    private String description;
    private String systemPrompt;
    private List<Capability> capabilities = new ArrayList<>();

    // null means the orchestrator's default model
    private String model;
    private int maxTokens = 4096;
    private double temperature = 0.7;

    public String resolveModel(String defaultModel) {
        return model == null || model.isBlank() ? defaultModel : model;
    }
}
