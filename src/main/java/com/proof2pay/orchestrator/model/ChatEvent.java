package com.proof2pay.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ChatEvent {
    String channel;
    String author;
    String text;
    Instant timestamp;
    // Slack ts of the thread root, or of the message itself outside a thread
    String threadTs;
    boolean fromBot;
}
