package com.e2eq.obo.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.*;

/**
 * Computes a stable hash of an ontology's graph by canonicalizing it to sorted JSON.
 * Two ontologies with the same hash have the same term and typedef ids, names, {@code is_a}
 * sets, relationship sets and inverse pairs. Definitions, annotations, header and diagnostics
 * are not part of the hash, and neither is insertion order.
 */
public final class OntologyHasher {
    private OntologyHasher() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public static String computeHash(Ontology ontology) {
        try {
            Map<String, Object> canonical = canonicalize(ontology);
            String json = MAPPER.writeValueAsString(canonical);
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(json.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (Exception e) {
            throw new RuntimeException("Failed to compute ontology hash", e);
        }
    }

    static Map<String, Object> canonicalize(Ontology ontology) {
        Map<String, Object> result = new TreeMap<>();

        Map<String, Object> terms = new TreeMap<>();
        for (Term t : ontology.terms()) {
            Map<String, Object> tData = new TreeMap<>();
            tData.put("name", t.name());
            tData.put("is_a", new TreeSet<>(t.isA()));
            Map<String, Object> rels = new TreeMap<>();
            t.relationships().forEach((rel, targets) -> rels.put(rel, new TreeSet<>(targets)));
            tData.put("relationships", rels);
            terms.put(t.id(), tData);
        }
        result.put("terms", terms);

        Map<String, Object> typedefs = new TreeMap<>();
        for (Typedef td : ontology.typedefs()) {
            Map<String, Object> tdData = new TreeMap<>();
            tdData.put("name", td.name());
            tdData.put("inverse_of", td.inverseOf().orElse(null));
            typedefs.put(td.id(), tdData);
        }
        result.put("typedefs", typedefs);

        return result;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
