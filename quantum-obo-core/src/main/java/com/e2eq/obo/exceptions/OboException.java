package com.e2eq.obo.exceptions;

/**
 * Base type for structural failures raised while parsing, building, merging or querying an
 * ontology. Soft problems are never raised; they are attached to results as diagnostics.
 */
public class OboException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public OboException(String message) {
        super(message);
    }

    public OboException(String message, Throwable cause) {
        super(message, cause);
    }
}
