package com.proof2pay.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScheduleClass {
    ALWAYS_ON(0),
    DAILY(1),
    WEEKLY(7),
    BIWEEKLY(14),
    EVENT_TRIGGERED(0);

    private final int periodDays;

    ScheduleClass(int periodDays) {
        this.periodDays = periodDays;
    }

    public int getPeriodDays() {
        return periodDays;
    }

    /**
     * Only daily, weekly and biweekly agents are fired by the scheduler tick.
     */
    public boolean isTimeTriggered() {
        return periodDays > 0;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScheduleClass fromValue(String value) {
        if (value == null || value.isBlank()) {
            return EVENT_TRIGGERED;
        }
        return ScheduleClass.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
