package com.e2eq.obo.core;

import java.util.*;

/**
 * Computes the derived views of an ontology graph: child index, transitive closures of the
 * {@code is_a} hierarchy and the inverse relationship index.
 * Only resolved edges take part; {@link Ontology} caches the results.
 */
public final class OntologyClosures {
    private OntologyClosures() {}

    /**
     * Returns the direct parents of the given term whose ids resolve.
     */
    public static Set<String> computeParents(String termId, Map<String, Term> terms) {
        Term term = terms.get(termId);
        if (term == null) return Set.of();
        Set<String> result = new LinkedHashSet<>();
        for (String parent : term.isA()) {
            if (terms.containsKey(parent)) result.add(parent);
        }
        return result;
    }

    /**
     * Builds parent id to child ids over every resolved {@code is_a} edge.
     * Children are listed in term insertion order.
     */
    public static Map<String, Set<String>> computeChildIndex(Map<String, Term> terms) {
        Map<String, Set<String>> index = new HashMap<>();
        for (Term t : terms.values()) {
            for (String parent : t.isA()) {
                if (terms.containsKey(parent)) {
                    index.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(t.id());
                }
            }
        }
        index.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        return Collections.unmodifiableMap(index);
    }

    /**
     * Returns all ancestors of the given term (transitive closure of parents), nearest first.
     */
    public static Set<String> computeAncestors(String termId, Map<String, Term> terms) {
        return closure(termId, id -> computeParents(id, terms));
    }

    /**
     * Returns all descendants of the given term (transitive closure of children), nearest first.
     */
    public static Set<String> computeDescendants(String termId, Map<String, Set<String>> childIndex) {
        return closure(termId, id -> childIndex.getOrDefault(id, Set.of()));
    }

    /**
     * Depth-limited closure. With {@code intermediate} every term at most {@code level} steps
     * away is returned; without it only terms exactly {@code level} steps away. A negative level
     * means unbounded, in which case {@code intermediate} is ignored.
     */
    public static Set<String> computeLevels(String termId, int level, boolean intermediate, Step step) {
        if (level < 0) return closure(termId, step);
        if (level == 0) return Set.of();
        Set<String> result = new LinkedHashSet<>();
        Set<String> frontier = new LinkedHashSet<>(List.of(termId));
        for (int depth = 1; depth <= level && !frontier.isEmpty(); depth++) {
            Set<String> next = new LinkedHashSet<>();
            for (String id : frontier) {
                next.addAll(step.next(id));
            }
            if (intermediate) result.addAll(next);
            frontier = next;
        }
        return intermediate ? result : frontier;
    }

    /**
     * Builds typedef id to target id to source ids over every stored relationship edge whose
     * target resolves. Used to answer inverse relationship queries.
     */
    public static Map<String, Map<String, Set<String>>> computeIncomingIndex(Map<String, Term> terms) {
        Map<String, Map<String, Set<String>>> index = new HashMap<>();
        for (Term t : terms.values()) {
            t.relationships().forEach((rel, targets) -> {
                for (String target : targets) {
                    if (terms.containsKey(target)) {
                        index.computeIfAbsent(rel, k -> new HashMap<>())
                                .computeIfAbsent(target, k -> new LinkedHashSet<>())
                                .add(t.id());
                    }
                }
            });
        }
        return index;
    }

    /**
     * Returns the registered inverse of the given typedef. Built typedefs declare their inverse
     * pairs mutually; an {@code inverse_of} naming no registered typedef counts as no inverse.
     */
    public static Optional<String> computeInverse(String typedefId, Map<String, Typedef> typedefs) {
        Typedef def = typedefs.get(typedefId);
        if (def == null) return Optional.empty();
        return def.inverseOf().filter(typedefs::containsKey);
    }

    private static Set<String> closure(String start, Step step) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : step.next(current)) {
                if (result.add(next)) {
                    queue.add(next);
                }
            }
        }
        // a well-formed DAG never reaches the start again
        result.remove(start);
        return result;
    }

    @FunctionalInterface
    public interface Step {
        Set<String> next(String termId);
    }
}
