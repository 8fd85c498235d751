package com.autonomous.orchestrator.model;

import lombok.Value;

@Value
public class VerificationResult {
    Verdict verdict;
    String feedback;

    public boolean isApproved() {
        return verdict == Verdict.APPROVED;
    }
}
