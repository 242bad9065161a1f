package com.proof2pay.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A unit of dispatched work. Never mutated after dispatch; follow-on work is a new task.
 */
@Value
@Builder(toBuilder = true)
public class Task {

    public static final String HINT_MODEL_TIER = "model_tier";
    public static final String HINT_DOCUMENT_REF = "document_ref";
    public static final String HINT_AUTHOR = "author";
    public static final String HINT_CONVERSATION = "conversation_id";
    public static final String HINT_SOURCE_AGENT = "source_agent";
    public static final String HINT_TRIGGER = "trigger";
    public static final String HINT_CYCLE_DIGEST = "cycle_digest";
    public static final String HINT_CYCLE_SUCCEEDED = "cycle_succeeded";
    public static final String HINT_CYCLE_FAILED = "cycle_failed";

    String id;
    TaskOrigin origin;

    @Builder.Default
    List<String> targetAgentIds = List.of();

    String instruction;

    @Builder.Default
    Map<String, String> hints = Map.of();

    @Builder.Default
    TaskPriority priority = TaskPriority.NORMAL;

    Instant createdAt;

    // Reply channel, set for human-originated tasks
    String channel;

    String parentTaskId;

    int hop;

    String cycleId;

    @Builder.Default
    TaskKind kind = TaskKind.STANDARD;

    public String hint(String key) {
        return hints.get(key);
    }
}
