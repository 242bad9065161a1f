package com.proof2pay.orchestrator.model;

import lombok.Value;

@Value
public class ReasoningResult {
    String text;
    TokenUsage usage;
    String model;
}
