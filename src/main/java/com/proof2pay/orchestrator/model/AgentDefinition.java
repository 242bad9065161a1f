package com.proof2pay.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One configured agent of the roster. Loaded from YAML at startup and treated as read-only afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentDefinition {

    public static final String ALL_AGENTS = "*";
    public static final String INCLUDE_PRODUCT_DOCS = "product_docs";
    public static final String INCLUDE_PRIORITIES = "priorities";

    private String id;
    private String name;
    private String capabilityTag;

    @Builder.Default
    private ScheduleClass scheduleClass = ScheduleClass.EVENT_TRIGGERED;

    @Builder.Default
    private ModelTier modelTier = ModelTier.SONNET;

    // Upstream agents that must finish first when they are part of the same task
    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    // Agents whose rolling summary is added to this agent's context
    @Builder.Default
    private List<String> contextFrom = new ArrayList<>();

    // Shared documents added to the context: product_docs, priorities
    @Builder.Default
    private List<String> contextIncludes = new ArrayList<>();

    @Builder.Default
    private String scheduleWeekday = "monday";

    private String defaultInstruction;

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public boolean includes(String sharedContext) {
        return contextIncludes != null && contextIncludes.contains(sharedContext);
    }

    public DayOfWeek getWeekday() {
        return DayOfWeek.valueOf(scheduleWeekday.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Number of dot-separated segments in the capability tag. A deeper tag is a narrower capability.
     */
    public int getCapabilityDepth() {
        if (capabilityTag == null || capabilityTag.isBlank()) {
            return 0;
        }
        return capabilityTag.split("\\.").length;
    }
}
