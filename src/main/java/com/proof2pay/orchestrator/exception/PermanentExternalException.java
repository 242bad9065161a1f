package com.proof2pay.orchestrator.exception;

import com.proof2pay.orchestrator.model.RunErrorKind;

/**
 * Malformed request, auth failure and similar. Never retried.
 */
public class PermanentExternalException extends ExternalCallException {

    public PermanentExternalException(String message) {
        super(RunErrorKind.PERMANENT_EXTERNAL, false, message);
    }

    public PermanentExternalException(String message, Throwable cause) {
        super(RunErrorKind.PERMANENT_EXTERNAL, false, message, cause);
    }
}
