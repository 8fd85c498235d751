package com.autonomous.orchestrator.exception;

import com.autonomous.orchestrator.model.AgentType;

public class AgentNotFoundException extends OrchestratorException {

    public AgentNotFoundException(AgentType type) {
        super("AGENT_NOT_FOUND", "No agent registered for type: " + type);
    }
}
