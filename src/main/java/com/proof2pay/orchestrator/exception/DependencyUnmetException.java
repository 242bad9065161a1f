package com.proof2pay.orchestrator.exception;

/**
 * An upstream run in a dependency chain failed, so the downstream agent is skipped.
 */
public class DependencyUnmetException extends RuntimeException {

    private final String agentId;
    private final String upstreamAgentId;

    public DependencyUnmetException(String agentId, String upstreamAgentId) {
        super("Skipped " + agentId + ": upstream " + upstreamAgentId + " did not succeed");
        this.agentId = agentId;
        this.upstreamAgentId = upstreamAgentId;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getUpstreamAgentId() {
        return upstreamAgentId;
    }
}
