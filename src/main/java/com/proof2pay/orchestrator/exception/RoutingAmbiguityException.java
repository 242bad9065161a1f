package com.proof2pay.orchestrator.exception;

/**
 * The dispatcher could not resolve a task without explicit targets to any agent.
 */
public class RoutingAmbiguityException extends RuntimeException {

    private final String taskId;

    public RoutingAmbiguityException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
