package com.autonomous.orchestrator.model;

/**
 * Kind of line written to the cost ledger. Only GENERATION and VERIFICATION carry spend;
 * CONFIRMATION and RESET are operator markers replayed on startup.
 */
public enum CostOperation {
    GENERATION,
    VERIFICATION,
    CONFIRMATION,
    RESET
}
