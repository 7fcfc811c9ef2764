package com.e2eq.obo.exceptions;

public class TermNotFoundException extends OboException {
    private static final long serialVersionUID = 1L;

    private final String id;

    public TermNotFoundException(String id) {
        super("No term with id '" + id + "'");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
