package com.autonomous.orchestrator.exception;

/**
 * Model call failure. Retried with backoff before the task is failed.
 */
public class ProviderException extends OrchestratorException {

    public ProviderException(String message) {
        super("PROVIDER_ERROR", message);
    }

    public ProviderException(String message, Throwable cause) {
        super("PROVIDER_ERROR", message, cause);
    }
}
