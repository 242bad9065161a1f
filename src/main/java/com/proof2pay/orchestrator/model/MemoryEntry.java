package com.proof2pay.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only record of one finished run in an agent's memory log. The full output lives at {@code rawRef}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryEntry {
    private String agentId;
    private Instant timestamp;
    private long sequence;
    private String taskId;
    private String summary;
    private String rawRef;
}
