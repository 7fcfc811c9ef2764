package com.e2eq.obo.core;

import java.util.List;
import java.util.Objects;

/**
 * The unvalidated output of a format adapter: entities in source order with raw id references,
 * plus whatever diagnostics the adapter collected. {@link GraphBuilder} turns it into an
 * {@link Ontology}.
 */
public record RawEntitySet(OntologyHeader header,
                           String defaultNamespace,
                           List<Typedef> typedefs,
                           List<Term> terms,
                           List<Diagnostic> diagnostics) {

    public RawEntitySet {
        header = header == null ? OntologyHeader.empty() : header;
        defaultNamespace = defaultNamespace == null ? "" : defaultNamespace;
        typedefs = List.copyOf(Objects.requireNonNull(typedefs, "typedefs"));
        terms = List.copyOf(Objects.requireNonNull(terms, "terms"));
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * The entities of an already built ontology, for re-validation. Diagnostics are not carried.
     */
    public static RawEntitySet of(Ontology ontology) {
        return new RawEntitySet(ontology.header(), ontology.defaultNamespace(),
                List.copyOf(ontology.typedefs()), List.copyOf(ontology.terms()), List.of());
    }
}
