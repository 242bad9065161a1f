package com.proof2pay.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One message of a chat thread an agent took part in. {@code role} is {@code user} or {@code assistant}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private String role;
    private String content;
    private Instant timestamp;
}
