package com.proof2pay.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReasoningRequest {
    String systemPrompt;
    String userMessage;

    // Earlier turns of the chat thread, oldest first, sent before the user message
    @Builder.Default
    List<ConversationTurn> history = List.of();

    @Builder.Default
    ModelTier modelTier = ModelTier.SONNET;

    @Builder.Default
    int maxTokens = 8192;
}
