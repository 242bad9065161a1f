package com.proof2pay.orchestrator.model;

public enum RunStatus {
    PENDING,
    RUNNING,
    RETRYING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
