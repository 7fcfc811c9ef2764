package com.e2eq.obo.core;

import com.e2eq.obo.core.Diagnostic.Kind;
import com.e2eq.obo.exceptions.InverseConflictException;
import com.e2eq.obo.exceptions.MergeConflictException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Merges two ontologies. The primary keeps its metadata; the secondary contributes everything
 * the primary lacks. Edge sets of shared terms are unioned, never replaced.
 * <p>
 * The result is a new {@link Ontology}; neither input is changed, and nothing is returned when
 * the merge fails.
 * </p>
 */
public final class OntologyMerger {
    private static final Logger LOG = Logger.getLogger(OntologyMerger.class);

    private OntologyMerger() {}

    public static Ontology merge(Ontology primary, Ontology secondary) {
        Objects.requireNonNull(primary, "primary");
        Objects.requireNonNull(secondary, "secondary");
        List<Diagnostic> diagnostics = new ArrayList<>();

        // Typedefs: union; a declared inverse fills a missing one, two different ones conflict
        Map<String, Typedef> typedefs = new LinkedHashMap<>(primary.typedefMap());
        for (Typedef st : secondary.typedefs()) {
            Typedef pt = typedefs.get(st.id());
            if (pt == null) {
                typedefs.put(st.id(), st);
                continue;
            }
            if (pt.inverseOf().isPresent() && st.inverseOf().isPresent() && !pt.inverseOf().equals(st.inverseOf())) {
                LOG.warnf("Merge rejected: typedef %s has inverse_of %s in primary and %s in secondary",
                        st.id(), pt.inverseOf().get(), st.inverseOf().get());
                throw new MergeConflictException(st.id(), pt.inverseOf().get(), st.inverseOf().get());
            }
            Typedef.Builder b = Typedef.builder(pt);
            if (b.inverseOf() == null) st.inverseOf().ifPresent(b::inverseOf);
            if (!b.hasName()) b.name(st.name());
            if (!b.hasDefinition()) st.definition().ifPresent(b::definition);
            st.annotations().forEach((tag, values) -> values.forEach(v -> b.addAnnotation(tag, v)));
            typedefs.put(st.id(), b.build());
        }

        // Terms: union of edges; primary's name, definition, namespace and obsolete flag win
        Map<String, Term> terms = new LinkedHashMap<>(primary.termMap());
        for (Term s : secondary.terms()) {
            Term p = terms.get(s.id());
            if (p == null) {
                terms.put(s.id(), s);
                continue;
            }
            if (!p.name().isEmpty() && !s.name().isEmpty() && !p.name().equals(s.name())) {
                diagnostics.add(Diagnostic.of(Kind.NAME_CONFLICT, s.id(),
                        "Kept name '" + p.name() + "' over '" + s.name() + "'"));
            }
            Term.Builder b = Term.builder(p).union(s);
            if (p.name().isEmpty()) b.name(s.name());
            if (!b.hasDefinition()) s.definition().ifPresent(b::definition);
            terms.put(s.id(), b.build());
        }

        RawEntitySet union = new RawEntitySet(
                primary.header().mergedWith(secondary.header()),
                primary.defaultNamespace().isEmpty() ? secondary.defaultNamespace() : primary.defaultNamespace(),
                new ArrayList<>(typedefs.values()),
                new ArrayList<>(terms.values()),
                diagnostics);

        Ontology merged;
        try {
            merged = GraphBuilder.build(union);
        } catch (InverseConflictException e) {
            LOG.warnf("Merge rejected: %s", e.getMessage());
            throw new MergeConflictException("Merged typedefs disagree on inverse pairing: " + e.getMessage(), e);
        }
        LOG.debugf("Merged %d + %d terms into %d", primary.size(), secondary.size(), merged.size());
        return merged;
    }
}
