package com.e2eq.obo.core;

import java.util.*;

/**
 * Ontology-level metadata from the lines preceding the first stanza, kept in input order.
 */
public record OntologyHeader(Map<String, List<String>> entries) {

    public static final String FORMAT_VERSION = "format-version";
    public static final String DEFAULT_NAMESPACE = "default-namespace";
    public static final String NAMESPACE = "namespace";
    public static final String REMARK = "remark";
    public static final String IMPORT = "import";

    private static final OntologyHeader EMPTY = new OntologyHeader(Map.of());

    public OntologyHeader {
        entries = Term.copyAnnotations(entries);
    }

    public static OntologyHeader empty() {
        return EMPTY;
    }

    public List<String> values(String key) {
        return entries.getOrDefault(key, List.of());
    }

    public Optional<String> first(String key) {
        List<String> v = values(key);
        return v.isEmpty() ? Optional.empty() : Optional.of(v.get(0));
    }

    public Optional<String> formatVersion() {
        return first(FORMAT_VERSION);
    }

    /**
     * The {@code default-namespace} entry, falling back to a plain {@code namespace} entry.
     */
    public Optional<String> defaultNamespace() {
        Optional<String> ns = first(DEFAULT_NAMESPACE);
        return ns.isPresent() ? ns : first(NAMESPACE);
    }

    public List<String> remarks() {
        return values(REMARK);
    }

    public List<String> imports() {
        return values(IMPORT);
    }

    /**
     * Keys already present here win; keys only present in {@code other} are appended in
     * their original order.
     */
    public OntologyHeader mergedWith(OntologyHeader other) {
        Map<String, List<String>> merged = new LinkedHashMap<>(entries);
        other.entries().forEach(merged::putIfAbsent);
        return new OntologyHeader(merged);
    }

    public static final class Builder {
        private final Map<String, List<String>> entries = new LinkedHashMap<>();

        public Builder add(String key, String value) {
            entries.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Optional<String> defaultNamespace() {
            return new OntologyHeader(entries).defaultNamespace();
        }

        public OntologyHeader build() {
            return new OntologyHeader(entries);
        }
    }
}
