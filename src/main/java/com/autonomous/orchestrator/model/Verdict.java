package com.autonomous.orchestrator.model;

public enum Verdict {
    APPROVED,
    REJECTED,
    NEEDS_RETRY
}
