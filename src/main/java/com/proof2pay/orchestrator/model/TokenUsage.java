package com.proof2pay.orchestrator.model;

import lombok.Value;

@Value
public class TokenUsage {

    public static final TokenUsage ZERO = new TokenUsage(0, 0);

    long inputTokens;
    long outputTokens;

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(inputTokens + other.inputTokens, outputTokens + other.outputTokens);
    }

    public long getTotalTokens() {
        return inputTokens + outputTokens;
    }
}
