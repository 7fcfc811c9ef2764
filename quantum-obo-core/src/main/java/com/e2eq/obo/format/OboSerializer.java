package com.e2eq.obo.format;

import com.e2eq.obo.core.Ontology;
import com.e2eq.obo.core.OntologyHeader;
import com.e2eq.obo.core.Term;
import com.e2eq.obo.core.Typedef;
import com.e2eq.obo.parser.TagValue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes an ontology as stanza text: header, typedef stanzas, then term stanzas, each in
 * insertion order. Reference comments are regenerated from the current names, so output is
 * deterministic for a given ontology.
 */
public final class OboSerializer {

    public String serialize(Ontology ontology) {
        StringBuilder sb = new StringBuilder();
        try {
            write(ontology, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    public void write(Ontology ontology, Writer writer) throws IOException {
        write(ontology, (Appendable) writer);
        writer.flush();
    }

    private void write(Ontology ontology, Appendable out) throws IOException {
        OntologyHeader header = ontology.header();
        for (Map.Entry<String, List<String>> e : header.entries().entrySet()) {
            for (String value : e.getValue()) {
                tag(out, e.getKey(), value);
            }
        }
        if (header.defaultNamespace().isEmpty() && !ontology.defaultNamespace().isEmpty()) {
            tag(out, OntologyHeader.DEFAULT_NAMESPACE, ontology.defaultNamespace());
        }

        for (Typedef td : ontology.typedefs()) {
            out.append('\n').append("[Typedef]\n");
            tag(out, "id", td.id());
            if (!td.name().isEmpty()) tag(out, "name", td.name());
            if (td.definition().isPresent()) tag(out, "def", td.definition().get().toOboValue());
            annotations(out, td.annotations());
            if (td.inverseOf().isPresent()) {
                String inverse = td.inverseOf().get();
                reference(out, "inverse_of", inverse,
                        ontology.typedef(inverse).map(Typedef::name).orElse(""));
            }
            if (td.obsolete()) tag(out, "is_obsolete", "true");
        }

        for (Term t : ontology.terms()) {
            out.append('\n').append("[Term]\n");
            tag(out, "id", t.id());
            if (!t.name().isEmpty()) tag(out, "name", t.name());
            if (!t.namespace().isEmpty()) tag(out, "namespace", t.namespace());
            if (t.definition().isPresent()) tag(out, "def", t.definition().get().toOboValue());
            annotations(out, t.annotations());
            for (String parent : t.isA()) {
                reference(out, "is_a", parent, nameOf(ontology, parent));
            }
            for (Map.Entry<String, Set<String>> rel : t.relationships().entrySet()) {
                for (String target : rel.getValue()) {
                    reference(out, "relationship", rel.getKey() + " " + target, nameOf(ontology, target));
                }
            }
            if (t.obsolete()) tag(out, "is_obsolete", "true");
        }
    }

    private static String nameOf(Ontology ontology, String termId) {
        Optional<Term> t = ontology.findTerm(termId);
        return t.map(Term::name).orElse("");
    }

    private static void annotations(Appendable out, Map<String, List<String>> annotations) throws IOException {
        for (Map.Entry<String, List<String>> e : annotations.entrySet()) {
            for (String value : e.getValue()) {
                tag(out, e.getKey(), value);
            }
        }
    }

    private static void reference(Appendable out, String tag, String value, String name) throws IOException {
        out.append(tag).append(": ").append(value);
        if (!name.isEmpty()) out.append(" ! ").append(name);
        out.append('\n');
    }

    private static void tag(Appendable out, String tag, String value) throws IOException {
        out.append(tag).append(": ").append(TagValue.escape(value)).append('\n');
    }
}
