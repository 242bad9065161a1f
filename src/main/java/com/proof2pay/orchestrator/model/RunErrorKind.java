package com.proof2pay.orchestrator.model;

public enum RunErrorKind {
    TRANSIENT_EXTERNAL,
    PERMANENT_EXTERNAL,
    MALFORMED_OUTPUT,
    ROUTING_AMBIGUITY,
    DEPENDENCY_UNMET,
    UNKNOWN_AGENT,
    DOCUMENT_FETCH,
    MEMORY_WRITE,
    INTERNAL
}
