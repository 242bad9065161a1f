package com.proof2pay.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One execution of one agent against one task. Written only by the runner; the dispatcher reads it once terminal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Run {
    private String id;
    private String taskId;
    private String agentId;
    private volatile RunStatus status;
    private int attemptCount;
    private Instant startedAt;
    private Instant finishedAt;
    private String result;
    private RunError error;
    private ModelTier modelTier;

    @Builder.Default
    private TokenUsage usage = TokenUsage.ZERO;

    private String memoryEntryRef;

    @Builder.Default
    private List<AttemptRecord> attempts = new ArrayList<>();

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isSucceeded() {
        return status == RunStatus.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == RunStatus.FAILED;
    }
}
