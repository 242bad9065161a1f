package com.proof2pay.orchestrator.exception;

import com.proof2pay.orchestrator.model.RunErrorKind;

/**
 * Rate limit, timeout or transient I/O failure. Always retryable.
 */
public class TransientExternalException extends ExternalCallException {

    public TransientExternalException(String message) {
        super(RunErrorKind.TRANSIENT_EXTERNAL, true, message);
    }

    public TransientExternalException(String message, Throwable cause) {
        super(RunErrorKind.TRANSIENT_EXTERNAL, true, message, cause);
    }

    public TransientExternalException(RunErrorKind kind, String message) {
        super(kind, true, message);
    }

    public TransientExternalException(RunErrorKind kind, String message, Throwable cause) {
        super(kind, true, message, cause);
    }
}
