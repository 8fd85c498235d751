package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.ProviderException;
import com.autonomous.orchestrator.model.ModelResponse;

/**
 * Narrow boundary to whatever actually runs model inference.
 */
public interface ModelInvoker {

    /**
     * Sends a prompt to the named model.
     *
     * @throws ProviderException on any provider-side failure; callers retry these
     */
    ModelResponse invoke(String prompt, String model, int maxTokens);
}
