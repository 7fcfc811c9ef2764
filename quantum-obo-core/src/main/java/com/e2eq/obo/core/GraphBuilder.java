package com.e2eq.obo.core;

import com.e2eq.obo.core.Diagnostic.Kind;
import com.e2eq.obo.exceptions.CycleDetectedException;
import com.e2eq.obo.exceptions.InverseConflictException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Turns a raw entity set into a validated {@link Ontology}: pairs typedef inverses, reports
 * unresolved references and rejects {@code is_a} cycles.
 */
public final class GraphBuilder {
    private static final Logger LOG = Logger.getLogger(GraphBuilder.class);

    private GraphBuilder() {}

    public static Ontology build(RawEntitySet raw) {
        Objects.requireNonNull(raw, "raw");
        List<Diagnostic> diagnostics = new ArrayList<>(raw.diagnostics());
        List<UnresolvedReference> unresolved = new ArrayList<>();

        Map<String, Typedef> typedefs = combineTypedefs(raw.typedefs(), diagnostics);
        Map<String, Term> terms = combineTerms(raw.terms(), diagnostics);

        pairInverses(typedefs, diagnostics, unresolved);
        collectUnresolved(terms, typedefs, unresolved);
        detectCycles(terms);

        if (!unresolved.isEmpty()) {
            LOG.debugf("%d unresolved reference(s) left out of the graph", unresolved.size());
        }
        LOG.debugf("Built ontology with %d terms and %d typedefs", terms.size(), typedefs.size());
        return new Ontology(raw.header(), raw.defaultNamespace(), terms, typedefs, unresolved, diagnostics);
    }

    private static Map<String, Typedef> combineTypedefs(List<Typedef> defs, List<Diagnostic> diagnostics) {
        Map<String, Typedef> result = new LinkedHashMap<>();
        for (Typedef td : defs) {
            Typedef existing = result.get(td.id());
            if (existing == null) {
                result.put(td.id(), td);
                continue;
            }
            if (existing.inverseOf().isPresent() && td.inverseOf().isPresent()
                    && !existing.inverseOf().equals(td.inverseOf())) {
                throw new InverseConflictException("Typedef '" + td.id() + "' is declared twice with inverse_of '"
                        + existing.inverseOf().get() + "' and '" + td.inverseOf().get() + "'");
            }
            Typedef.Builder b = Typedef.builder(existing);
            if (!b.hasName()) b.name(td.name());
            if (!b.hasDefinition()) td.definition().ifPresent(b::definition);
            if (b.inverseOf() == null) td.inverseOf().ifPresent(b::inverseOf);
            td.annotations().forEach((tag, values) -> values.forEach(v -> b.addAnnotation(tag, v)));
            result.put(td.id(), b.obsolete(existing.obsolete() || td.obsolete()).build());
            diagnostics.add(Diagnostic.of(Kind.DUPLICATE_ID, td.id(), "Typedef stanzas with the same id were combined"));
        }
        return result;
    }

    private static Map<String, Term> combineTerms(List<Term> raw, List<Diagnostic> diagnostics) {
        Map<String, Term> result = new LinkedHashMap<>();
        for (Term t : raw) {
            Term existing = result.get(t.id());
            if (existing == null) {
                result.put(t.id(), t);
                continue;
            }
            Term.Builder b = Term.builder(existing).union(t);
            if (existing.name().isEmpty()) b.name(t.name());
            if (!b.hasDefinition()) t.definition().ifPresent(b::definition);
            result.put(t.id(), b.obsolete(existing.obsolete() || t.obsolete()).build());
            diagnostics.add(Diagnostic.of(Kind.DUPLICATE_ID, t.id(), "Term stanzas with the same id were combined"));
        }
        return result;
    }

    /**
     * Makes every declared inverse mutual. A one-sided declaration is repaired; two declarations
     * that disagree raise {@link InverseConflictException}.
     */
    static void pairInverses(Map<String, Typedef> typedefs, List<Diagnostic> diagnostics,
                             List<UnresolvedReference> unresolved) {
        for (String id : new ArrayList<>(typedefs.keySet())) {
            Typedef td = typedefs.get(id);
            if (td.inverseOf().isEmpty()) continue;
            String inverseId = td.inverseOf().get();
            Typedef inverse = typedefs.get(inverseId);
            if (inverse == null) {
                unresolved.add(new UnresolvedReference(id, UnresolvedReference.Kind.INVERSE_OF, "inverse_of", inverseId));
                continue;
            }
            if (inverse.inverseOf().isEmpty()) {
                typedefs.put(inverseId, inverse.withInverseOf(id));
                diagnostics.add(Diagnostic.of(Kind.INVERSE_REPAIRED, inverseId,
                        "Declared inverse_of '" + id + "' to mirror '" + id + "'"));
            } else if (!inverse.inverseOf().get().equals(id)) {
                throw new InverseConflictException(id, inverseId, inverse.inverseOf().get());
            }
        }
    }

    private static void collectUnresolved(Map<String, Term> terms, Map<String, Typedef> typedefs,
                                          List<UnresolvedReference> unresolved) {
        for (Term t : terms.values()) {
            for (String parent : t.isA()) {
                if (!terms.containsKey(parent)) {
                    unresolved.add(new UnresolvedReference(t.id(), UnresolvedReference.Kind.IS_A, Ontology.IS_A, parent));
                }
            }
            t.relationships().forEach((rel, targets) -> {
                if (!typedefs.containsKey(rel)) {
                    unresolved.add(new UnresolvedReference(t.id(), UnresolvedReference.Kind.TYPEDEF, rel, rel));
                }
                for (String target : targets) {
                    if (!terms.containsKey(target)) {
                        unresolved.add(new UnresolvedReference(t.id(), UnresolvedReference.Kind.RELATIONSHIP_TARGET, rel, target));
                    }
                }
            });
        }
    }

    private enum Mark { IN_PROGRESS, DONE }

    /**
     * Depth-first search over resolved {@code is_a} edges, tracking the terms on the current path.
     */
    static void detectCycles(Map<String, Term> terms) {
        Map<String, Mark> marks = new HashMap<>();
        for (String start : terms.keySet()) {
            if (marks.containsKey(start)) continue;

            List<String> path = new ArrayList<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            marks.put(start, Mark.IN_PROGRESS);
            path.add(start);
            pending.push(OntologyClosures.computeParents(start, terms).iterator());

            while (!pending.isEmpty()) {
                Iterator<String> it = pending.peek();
                if (!it.hasNext()) {
                    pending.pop();
                    marks.put(path.remove(path.size() - 1), Mark.DONE);
                    continue;
                }
                String parent = it.next();
                Mark mark = marks.get(parent);
                if (mark == null) {
                    marks.put(parent, Mark.IN_PROGRESS);
                    path.add(parent);
                    pending.push(OntologyClosures.computeParents(parent, terms).iterator());
                } else if (mark == Mark.IN_PROGRESS) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(parent), path.size()));
                    cycle.add(parent);
                    throw new CycleDetectedException(cycle);
                }
            }
        }
    }
}
