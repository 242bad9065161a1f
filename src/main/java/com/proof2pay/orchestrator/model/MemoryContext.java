package com.proof2pay.orchestrator.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

@Value
public class MemoryContext {

    public static final MemoryContext EMPTY = new MemoryContext("", List.of());

    String summary;

    // Non-decreasing timestamp order
    List<MemoryEntry> entries;

    public boolean isEmpty() {
        return (summary == null || summary.isBlank()) && entries.isEmpty();
    }

    public String render() {
        StringBuilder text = new StringBuilder();
        if (summary != null && !summary.isBlank()) {
            text.append(summary.trim()).append("\n\n");
        }
        for (MemoryEntry entry : entries) {
            LocalDate day = LocalDate.ofInstant(entry.getTimestamp(), ZoneOffset.UTC);
            text.append("- [").append(day).append("] ").append(entry.getSummary()).append("\n");
        }
        return text.toString().trim();
    }
}
