package com.e2eq.obo.core;

import java.util.*;

/**
 * An ontology term. Edge sets hold raw ids; whether they resolve is decided by the owning
 * {@link Ontology}.
 *
 * @param isA           ids of the direct {@code is_a} parents, in declaration order
 * @param relationships typedef id to target ids, in declaration order
 * @param annotations   tags the model has no dedicated field for ({@code synonym},
 *                      {@code xref}, ...), kept so they survive re-serialization
 */
public record Term(String id,
                   String name,
                   String namespace,
                   Optional<Definition> definition,
                   Set<String> isA,
                   Map<String, Set<String>> relationships,
                   boolean obsolete,
                   Map<String, List<String>> annotations) {

    public Term {
        Objects.requireNonNull(id, "id");
        name = name == null ? "" : name;
        namespace = namespace == null ? "" : namespace;
        definition = definition == null ? Optional.empty() : definition;
        isA = isA == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(isA));
        relationships = copyRelationships(relationships);
        annotations = copyAnnotations(annotations);
    }

    /**
     * Stored targets of the given relationship; empty when the term has none.
     */
    public Set<String> targets(String typedefId) {
        return relationships.getOrDefault(typedefId, Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Term from) {
        Builder b = new Builder().id(from.id()).name(from.name()).namespace(from.namespace())
                .obsolete(from.obsolete());
        from.definition().ifPresent(b::definition);
        return b.union(from);
    }

    static Map<String, Set<String>> copyRelationships(Map<String, Set<String>> source) {
        if (source == null || source.isEmpty()) return Map.of();
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (v != null && !v.isEmpty()) copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v)));
        });
        return Collections.unmodifiableMap(copy);
    }

    static Map<String, List<String>> copyAnnotations(Map<String, List<String>> source) {
        if (source == null || source.isEmpty()) return Map.of();
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (v != null && !v.isEmpty()) copy.put(k, List.copyOf(v));
        });
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private String id;
        private String name;
        private String namespace;
        private Definition definition;
        private boolean obsolete;
        private final Set<String> isA = new LinkedHashSet<>();
        private final Map<String, Set<String>> relationships = new LinkedHashMap<>();
        private final Map<String, List<String>> annotations = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder namespace(String namespace) { this.namespace = namespace; return this; }
        public Builder definition(Definition definition) { this.definition = definition; return this; }
        public Builder obsolete(boolean obsolete) { this.obsolete = obsolete; return this; }

        public Builder addIsA(String parentId) {
            isA.add(parentId);
            return this;
        }

        public Builder addRelationship(String typedefId, String targetId) {
            relationships.computeIfAbsent(typedefId, k -> new LinkedHashSet<>()).add(targetId);
            return this;
        }

        public Builder addAnnotation(String tag, String value) {
            List<String> values = annotations.computeIfAbsent(tag, k -> new ArrayList<>());
            if (!values.contains(value)) values.add(value);
            return this;
        }

        /**
         * Adds every edge and annotation of {@code other}; scalar fields are left alone.
         */
        public Builder union(Term other) {
            other.isA().forEach(this::addIsA);
            other.relationships().forEach((rel, targets) -> targets.forEach(t -> addRelationship(rel, t)));
            other.annotations().forEach((tag, values) -> values.forEach(v -> addAnnotation(tag, v)));
            return this;
        }

        public String id() { return id; }
        public String name() { return name; }
        public boolean hasNamespace() { return namespace != null && !namespace.isEmpty(); }
        public boolean hasDefinition() { return definition != null; }

        public Term build() {
            return new Term(id, name, namespace, Optional.ofNullable(definition), isA, relationships,
                    obsolete, annotations);
        }
    }
}
