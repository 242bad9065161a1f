package com.proof2pay.orchestrator.exception;

import com.proof2pay.orchestrator.model.RunErrorKind;

/**
 * Failure of a call to an external collaborator. The runner retries iff {@link #isRetryable()}.
 */
public class ExternalCallException extends RuntimeException {

    private final RunErrorKind kind;
    private final boolean retryable;

    public ExternalCallException(RunErrorKind kind, boolean retryable, String message) {
        super(message);
        this.kind = kind;
        this.retryable = retryable;
    }

    public ExternalCallException(RunErrorKind kind, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public RunErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
