package com.proof2pay.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static org.junit.jupiter.api.Assertions.*;

class AgentDefinitionTest {

    @Test
    void shouldHaveDefaultValues() {
        AgentDefinition agent = AgentDefinition.builder().id("technical_pm").build();

        assertEquals(ScheduleClass.EVENT_TRIGGERED, agent.getScheduleClass());
        assertEquals(ModelTier.SONNET, agent.getModelTier());
        assertEquals(DayOfWeek.MONDAY, agent.getWeekday());
        assertTrue(agent.getDependsOn().isEmpty());
        assertEquals("technical_pm", agent.getDisplayName());
    }

    @Test
    void shouldMeasureCapabilityDepth() {
        assertEquals(0, AgentDefinition.builder().id("a").build().getCapabilityDepth());
        assertEquals(2, AgentDefinition.builder().id("a").capabilityTag("research.market").build()
            .getCapabilityDepth());
        assertEquals(3, AgentDefinition.builder().id("a").capabilityTag("research.market.competitors").build()
            .getCapabilityDepth());
    }

    @Test
    void shouldParseWeekdayAndScheduleClass() {
        AgentDefinition agent = AgentDefinition.builder()
            .id("brand_marketing")
            .scheduleClass(ScheduleClass.fromValue("biweekly"))
            .scheduleWeekday(" Tuesday ")
            .build();

        assertEquals(DayOfWeek.TUESDAY, agent.getWeekday());
        assertEquals(14, agent.getScheduleClass().getPeriodDays());
        assertTrue(agent.getScheduleClass().isTimeTriggered());
        assertFalse(ScheduleClass.fromValue("always_on").isTimeTriggered());
        assertEquals(ScheduleClass.EVENT_TRIGGERED, ScheduleClass.fromValue("event-triggered"));
    }
}
