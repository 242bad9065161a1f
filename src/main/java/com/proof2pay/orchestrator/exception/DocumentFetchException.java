package com.proof2pay.orchestrator.exception;

import com.proof2pay.orchestrator.model.RunErrorKind;

public class DocumentFetchException extends ExternalCallException {

    public DocumentFetchException(String message) {
        super(RunErrorKind.DOCUMENT_FETCH, false, message);
    }

    public DocumentFetchException(String message, Throwable cause) {
        super(RunErrorKind.DOCUMENT_FETCH, false, message, cause);
    }
}
