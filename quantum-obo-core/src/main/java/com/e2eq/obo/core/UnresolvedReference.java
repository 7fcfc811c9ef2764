package com.e2eq.obo.core;

/**
 * An id cited by a term or typedef that names nothing in the ontology. The citing edge stays on
 * the entity but is absent from the graph.
 *
 * @param relation {@code is_a}, {@code inverse_of}, or the typedef id of a relationship
 */
public record UnresolvedReference(String sourceId, Kind kind, String relation, String targetId) {

    public enum Kind {
        /** an {@code is_a} parent that is not a term */
        IS_A,
        /** a relationship target that is not a term */
        RELATIONSHIP_TARGET,
        /** a relationship whose typedef is not declared */
        TYPEDEF,
        /** an {@code inverse_of} naming an undeclared typedef */
        INVERSE_OF
    }

    @Override
    public String toString() {
        return sourceId + " " + relation + " " + targetId + " (" + kind + ")";
    }
}
