package com.proof2pay.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class Briefing {
    String cycleId;
    String text;
    Instant createdAt;
    int succeededRuns;
    int failedRuns;
    List<String> failureLines;
}
