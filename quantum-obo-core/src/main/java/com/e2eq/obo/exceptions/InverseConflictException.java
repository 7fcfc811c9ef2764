package com.e2eq.obo.exceptions;

/**
 * Thrown when two typedefs disagree about their inverse pairing: {@code typedefId} declares
 * {@code inverseId} as its inverse, but {@code inverseId} declares {@code conflictingId}.
 */
public class InverseConflictException extends OboException {
    private static final long serialVersionUID = 1L;

    private final String typedefId;
    private final String inverseId;
    private final String conflictingId;

    public InverseConflictException(String typedefId, String inverseId, String conflictingId) {
        super(String.format("Typedef '%s' declares inverse_of '%s', but '%s' declares inverse_of '%s'",
                typedefId, inverseId, inverseId, conflictingId));
        this.typedefId = typedefId;
        this.inverseId = inverseId;
        this.conflictingId = conflictingId;
    }

    public InverseConflictException(String message) {
        super(message);
        this.typedefId = null;
        this.inverseId = null;
        this.conflictingId = null;
    }

    public String getTypedefId() {
        return typedefId;
    }

    public String getInverseId() {
        return inverseId;
    }

    public String getConflictingId() {
        return conflictingId;
    }
}
