package com.autonomous.orchestrator.model;

/**
 * Closed set of agent kinds a task can be routed to.
 */
public enum AgentType {
    CODING,
    DESIGN,
    MARKETING,
    MAINTENANCE
}
