package com.autonomous.orchestrator.model;

public enum LedgerStatus {
    OK,
    PAUSED_NEEDS_CONFIRMATION
}
