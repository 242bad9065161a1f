package com.proof2pay.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageEntry {
    private Instant timestamp;
    private String agentId;
    private String taskId;
    private ModelTier modelTier;
    private long inputTokens;
    private long outputTokens;
    private double costUsd;
}
