package com.autonomous.orchestrator.exception;

import lombok.Getter;

/**
 * Root of the engine's exceptions. The code is surfaced to API callers as-is.
 */
@Getter
public class OrchestratorException extends RuntimeException {

    private final String code;

    public OrchestratorException(String code, String message) {
        super(message);
        this.code = code;
    }

    public OrchestratorException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
