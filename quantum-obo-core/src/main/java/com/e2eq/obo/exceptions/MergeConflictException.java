package com.e2eq.obo.exceptions;

/**
 * Thrown when two ontologies cannot be merged because a shared typedef declares different
 * inverses on each side. The merge is aborted and both inputs are left untouched.
 */
public class MergeConflictException extends OboException {
    private static final long serialVersionUID = 1L;

    private final String typedefId;
    private final String primaryInverse;
    private final String secondaryInverse;

    public MergeConflictException(String typedefId, String primaryInverse, String secondaryInverse) {
        super(String.format("Cannot merge typedef '%s': inverse_of '%s' in primary, '%s' in secondary",
                typedefId, primaryInverse, secondaryInverse));
        this.typedefId = typedefId;
        this.primaryInverse = primaryInverse;
        this.secondaryInverse = secondaryInverse;
    }

    public MergeConflictException(String message, Throwable cause) {
        super(message, cause);
        this.typedefId = null;
        this.primaryInverse = null;
        this.secondaryInverse = null;
    }

    public String getTypedefId() {
        return typedefId;
    }

    public String getPrimaryInverse() {
        return primaryInverse;
    }

    public String getSecondaryInverse() {
        return secondaryInverse;
    }
}
