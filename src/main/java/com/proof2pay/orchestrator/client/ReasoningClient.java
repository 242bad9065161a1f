package com.proof2pay.orchestrator.client;

import com.proof2pay.orchestrator.exception.ExternalCallException;
import com.proof2pay.orchestrator.model.ReasoningRequest;
import com.proof2pay.orchestrator.model.ReasoningResult;

/**
 * Single fallible call to the external reasoning service.
 */
public interface ReasoningClient {

    /**
     * @throws ExternalCallException
     *             classified as retryable or not
     */
    ReasoningResult invoke(String agentId, ReasoningRequest request);
}
