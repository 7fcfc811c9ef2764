package com.e2eq.obo.core;

import java.util.*;

/**
 * A relationship type declared by a {@code [Typedef]} stanza.
 *
 * @param inverseOf id of the typedef that relates targets back to sources; a typedef may name
 *                  itself to mark a symmetric relation
 */
public record Typedef(String id,
                      String name,
                      Optional<Definition> definition,
                      Optional<String> inverseOf,
                      boolean obsolete,
                      Map<String, List<String>> annotations) {

    public Typedef {
        Objects.requireNonNull(id, "id");
        name = name == null ? "" : name;
        definition = definition == null ? Optional.empty() : definition;
        inverseOf = inverseOf == null ? Optional.empty() : inverseOf.filter(s -> !s.isBlank());
        annotations = Term.copyAnnotations(annotations);
    }

    public Typedef(String id, String name, Optional<String> inverseOf) {
        this(id, name, Optional.empty(), inverseOf, false, Map.of());
    }

    public Typedef withInverseOf(String inverseId) {
        return new Typedef(id, name, definition, Optional.of(inverseId), obsolete, annotations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Typedef from) {
        Builder b = new Builder().id(from.id()).name(from.name()).obsolete(from.obsolete());
        from.definition().ifPresent(b::definition);
        from.inverseOf().ifPresent(b::inverseOf);
        from.annotations().forEach((tag, values) -> values.forEach(v -> b.addAnnotation(tag, v)));
        return b;
    }

    public static final class Builder {
        private String id;
        private String name;
        private Definition definition;
        private String inverseOf;
        private boolean obsolete;
        private final Map<String, List<String>> annotations = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder definition(Definition definition) { this.definition = definition; return this; }
        public Builder inverseOf(String inverseOf) { this.inverseOf = inverseOf; return this; }
        public Builder obsolete(boolean obsolete) { this.obsolete = obsolete; return this; }

        public Builder addAnnotation(String tag, String value) {
            List<String> values = annotations.computeIfAbsent(tag, k -> new ArrayList<>());
            if (!values.contains(value)) values.add(value);
            return this;
        }

        public String id() { return id; }
        public boolean hasName() { return name != null && !name.isEmpty(); }
        public boolean hasDefinition() { return definition != null; }
        public String inverseOf() { return inverseOf; }

        public Typedef build() {
            return new Typedef(id, name, Optional.ofNullable(definition), Optional.ofNullable(inverseOf),
                    obsolete, annotations);
        }
    }
}
