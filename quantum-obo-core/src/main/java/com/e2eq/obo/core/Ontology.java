package com.e2eq.obo.core;

import com.e2eq.obo.exceptions.TermNotFoundException;
import com.e2eq.obo.exceptions.UnresolvedReferenceException;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * A validated ontology: terms and typedefs in insertion order, header metadata, and the
 * diagnostics gathered while it was built.
 * <p>
 * Instances are immutable and only created by {@link GraphBuilder}. Traversal results are
 * computed on first use and cached, so an instance can be shared between threads freely.
 * Merging produces a new instance rather than changing this one.
 * </p>
 */
public final class Ontology implements Iterable<Term> {

    public static final String IS_A = "is_a";

    private final OntologyHeader header;
    private final String defaultNamespace;
    private final Map<String, Term> terms;
    private final Map<String, Typedef> typedefs;
    private final List<UnresolvedReference> unresolved;
    private final List<Diagnostic> diagnostics;

    // derived views, populated once
    private volatile Map<String, Set<String>> childIndex;
    private volatile Map<String, Map<String, Set<String>>> incomingIndex;
    private final Map<String, Set<String>> ancestorCache = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> descendantCache = new ConcurrentHashMap<>();

    Ontology(OntologyHeader header,
             String defaultNamespace,
             Map<String, Term> terms,
             Map<String, Typedef> typedefs,
             List<UnresolvedReference> unresolved,
             List<Diagnostic> diagnostics) {
        this.header = header;
        this.defaultNamespace = defaultNamespace;
        this.terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
        this.typedefs = Collections.unmodifiableMap(new LinkedHashMap<>(typedefs));
        this.unresolved = List.copyOf(unresolved);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public OntologyHeader header() { return header; }

    public String defaultNamespace() { return defaultNamespace; }

    public List<Diagnostic> diagnostics() { return diagnostics; }

    public List<UnresolvedReference> unresolvedReferences() { return unresolved; }

    /**
     * Same content with extra diagnostics appended. Caches are not shared.
     */
    public Ontology withAdditionalDiagnostics(Collection<Diagnostic> extra) {
        if (extra.isEmpty()) return this;
        List<Diagnostic> all = new ArrayList<>(diagnostics);
        all.addAll(extra);
        return new Ontology(header, defaultNamespace, terms, typedefs, unresolved, all);
    }

    /**
     * Fails with {@link UnresolvedReferenceException} if any reference did not resolve.
     */
    public Ontology requireResolved() {
        if (!unresolved.isEmpty()) {
            throw new UnresolvedReferenceException(
                    unresolved.stream().map(UnresolvedReference::toString).collect(Collectors.toList()));
        }
        return this;
    }

    // ---- lookup

    public boolean contains(String termId) {
        return terms.containsKey(termId);
    }

    public Term term(String termId) {
        Term t = terms.get(termId);
        if (t == null) throw new TermNotFoundException(termId);
        return t;
    }

    public Optional<Term> findTerm(String termId) {
        return Optional.ofNullable(terms.get(termId));
    }

    public Collection<Term> terms() { return terms.values(); }

    public Set<String> termIds() { return terms.keySet(); }

    public int size() { return terms.size(); }

    @Override
    public Iterator<Term> iterator() {
        return terms.values().iterator();
    }

    public Collection<Typedef> typedefs() { return typedefs.values(); }

    public Optional<Typedef> typedef(String typedefId) {
        return Optional.ofNullable(typedefs.get(typedefId));
    }

    public boolean containsTypedef(String typedefId) {
        return typedefs.containsKey(typedefId);
    }

    public Optional<String> inverseOf(String typedefId) {
        return OntologyClosures.computeInverse(typedefId, typedefs);
    }

    Map<String, Term> termMap() { return terms; }

    Map<String, Typedef> typedefMap() { return typedefs; }

    // ---- hierarchy

    public Set<Term> parents(String termId) {
        requireMember(termId);
        return toTerms(OntologyClosures.computeParents(termId, terms));
    }

    public Set<Term> children(String termId) {
        requireMember(termId);
        return toTerms(childIndex().getOrDefault(termId, Set.of()));
    }

    public Set<Term> ancestors(String termId) {
        requireMember(termId);
        return toTerms(ancestorCache.computeIfAbsent(termId,
                id -> Collections.unmodifiableSet(OntologyClosures.computeAncestors(id, terms))));
    }

    public Set<Term> descendants(String termId) {
        requireMember(termId);
        Map<String, Set<String>> index = childIndex();
        return toTerms(descendantCache.computeIfAbsent(termId,
                id -> Collections.unmodifiableSet(OntologyClosures.computeDescendants(id, index))));
    }

    /**
     * Ancestors at most {@code level} steps up, or exactly {@code level} steps up when
     * {@code intermediate} is false. A negative level is the same as {@link #ancestors(String)}.
     */
    public Set<Term> ancestors(String termId, int level, boolean intermediate) {
        if (level < 0) return ancestors(termId);
        requireMember(termId);
        return toTerms(OntologyClosures.computeLevels(termId, level, intermediate,
                id -> OntologyClosures.computeParents(id, terms)));
    }

    /**
     * Descendants at most {@code level} steps down, or exactly {@code level} steps down when
     * {@code intermediate} is false. A negative level is the same as {@link #descendants(String)}.
     */
    public Set<Term> descendants(String termId, int level, boolean intermediate) {
        if (level < 0) return descendants(termId);
        requireMember(termId);
        Map<String, Set<String>> index = childIndex();
        return toTerms(OntologyClosures.computeLevels(termId, level, intermediate,
                id -> index.getOrDefault(id, Set.of())));
    }

    /**
     * Union of the children of every given term, so {@code children(children(t))} yields the
     * grandchildren of {@code t}.
     */
    public Set<Term> children(Collection<Term> of) {
        Set<Term> result = new LinkedHashSet<>();
        for (Term t : of) result.addAll(children(t.id()));
        return Collections.unmodifiableSet(result);
    }

    /**
     * Union of the parents of every given term.
     */
    public Set<Term> parents(Collection<Term> of) {
        Set<Term> result = new LinkedHashSet<>();
        for (Term t : of) result.addAll(parents(t.id()));
        return Collections.unmodifiableSet(result);
    }

    // ---- relationships

    /**
     * Terms related to {@code termId} through {@code typedefId}: stored targets that resolve,
     * plus every term holding a stored edge of the inverse typedef back to {@code termId}.
     */
    public Set<Term> related(String termId, String typedefId) {
        Term term = term(termId);
        Set<String> ids = new LinkedHashSet<>();
        for (String target : term.targets(typedefId)) {
            if (terms.containsKey(target)) ids.add(target);
        }
        inverseOf(typedefId).ifPresent(inverse ->
                ids.addAll(incomingIndex().getOrDefault(inverse, Map.of()).getOrDefault(termId, Set.of())));
        return toTerms(ids);
    }

    /**
     * Every observable edge of the graph: {@code is_a} edges, stored relationship edges, and the
     * mirrored edges implied by inverse typedefs (flagged {@code derived}). Unresolved targets
     * are left out.
     */
    public List<Edge> edges() {
        Set<Edge> stored = new LinkedHashSet<>();
        for (Term t : terms.values()) {
            for (String parent : t.isA()) {
                if (terms.containsKey(parent)) stored.add(new Edge(t.id(), IS_A, parent, false));
            }
            t.relationships().forEach((rel, targets) -> {
                for (String target : targets) {
                    if (terms.containsKey(target)) stored.add(new Edge(t.id(), rel, target, false));
                }
            });
        }
        List<Edge> result = new ArrayList<>(stored);
        Set<Edge> seenDerived = new HashSet<>();
        for (Edge e : stored) {
            if (IS_A.equals(e.predicate())) continue;
            Optional<String> inverse = inverseOf(e.predicate());
            if (inverse.isEmpty()) continue;
            Edge mirrored = new Edge(e.target(), inverse.get(), e.source(), true);
            if (!stored.contains(mirrored.asStored()) && seenDerived.add(mirrored)) {
                result.add(mirrored);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public record Edge(String source, String predicate, String target, boolean derived) {
        Edge asStored() {
            return derived ? new Edge(source, predicate, target, false) : this;
        }
    }

    // ---- internals

    private void requireMember(String termId) {
        if (!terms.containsKey(termId)) throw new TermNotFoundException(termId);
    }

    private Set<Term> toTerms(Set<String> ids) {
        Set<Term> result = new LinkedHashSet<>();
        for (String id : ids) result.add(terms.get(id));
        return Collections.unmodifiableSet(result);
    }

    private Map<String, Set<String>> childIndex() {
        Map<String, Set<String>> idx = childIndex;
        if (idx == null) {
            synchronized (this) {
                idx = childIndex;
                if (idx == null) {
                    idx = OntologyClosures.computeChildIndex(terms);
                    childIndex = idx;
                }
            }
        }
        return idx;
    }

    private Map<String, Map<String, Set<String>>> incomingIndex() {
        Map<String, Map<String, Set<String>>> idx = incomingIndex;
        if (idx == null) {
            synchronized (this) {
                idx = incomingIndex;
                if (idx == null) {
                    idx = OntologyClosures.computeIncomingIndex(terms);
                    incomingIndex = idx;
                }
            }
        }
        return idx;
    }

    @Override
    public String toString() {
        return "Ontology[" + terms.size() + " terms, " + typedefs.size() + " typedefs]";
    }
}
