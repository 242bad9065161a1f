package com.proof2pay.orchestrator.model;

import lombok.Value;

import java.time.Instant;

@Value
public class AttemptRecord {
    int number;
    Instant at;
    boolean succeeded;
    RunErrorKind errorKind;
    String message;
}
