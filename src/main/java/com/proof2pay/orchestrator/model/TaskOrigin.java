package com.proof2pay.orchestrator.model;

public enum TaskOrigin {
    HUMAN_MESSAGE,
    SCHEDULE,
    AGENT_OUTPUT
}
