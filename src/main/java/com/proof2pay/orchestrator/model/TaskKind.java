package com.proof2pay.orchestrator.model;

public enum TaskKind {
    STANDARD,
    BRIEFING
}
