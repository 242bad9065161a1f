package com.proof2pay.orchestrator.model;

/**
 * Queue order is declaration order: interactive human requests come before any scheduled work.
 */
public enum TaskPriority {
    INTERACTIVE,
    HIGH,
    NORMAL,
    LOW
}
