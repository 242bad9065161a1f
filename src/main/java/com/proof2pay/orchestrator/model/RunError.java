package com.proof2pay.orchestrator.model;

import com.proof2pay.orchestrator.exception.ExternalCallException;
import lombok.Value;

@Value
public class RunError {
    RunErrorKind kind;
    String message;
    boolean retryable;

    public static RunError of(RunErrorKind kind, String message) {
        return new RunError(kind, message, false);
    }

    public static RunError from(ExternalCallException e) {
        return new RunError(e.getKind(), e.getMessage(), e.isRetryable());
    }
}
