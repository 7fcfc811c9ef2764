package com.e2eq.obo.exceptions;

import java.util.List;

/**
 * Raised only on request, by callers that want strict referential integrity. Ontologies are
 * otherwise built with unresolved references attached as a report.
 */
public class UnresolvedReferenceException extends OboException {
    private static final long serialVersionUID = 1L;

    private final List<String> references;

    public UnresolvedReferenceException(List<String> references) {
        super(references.size() + " unresolved reference(s): " + String.join("; ", references));
        this.references = List.copyOf(references);
    }

    public List<String> getReferences() {
        return references;
    }
}
