package com.e2eq.obo.parser;

import com.e2eq.obo.core.Definition;
import com.e2eq.obo.core.Diagnostic;
import com.e2eq.obo.core.Diagnostic.Kind;
import com.e2eq.obo.core.OntologyHeader;
import com.e2eq.obo.core.RawEntitySet;
import com.e2eq.obo.core.Term;
import com.e2eq.obo.core.Typedef;
import com.e2eq.obo.exceptions.OboParseException;
import com.e2eq.obo.spi.LineSource;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Reads stanza text into a {@link RawEntitySet}.
 * <p>
 * Header {@code key: value} lines come first, followed by {@code [Term]} and {@code [Typedef]}
 * stanzas. References are kept as raw ids, so a stanza may point at ids declared further down;
 * {@link com.e2eq.obo.core.GraphBuilder} resolves them. Lines the grammar does not accept are
 * recorded as diagnostics and skipped, unless the parser is strict. A stanza without an
 * {@code id} fails the whole parse.
 * </p>
 */
public final class StanzaParser {
    private static final Logger LOG = Logger.getLogger(StanzaParser.class);

    public static final String TERM = "Term";
    public static final String TYPEDEF = "Typedef";

    private enum State { HEADER, IN_TERM, IN_TYPEDEF, IN_UNKNOWN }

    private final ParserSettings settings;

    public StanzaParser() {
        this(ParserSettings.defaults());
    }

    public StanzaParser(ParserSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public ParserSettings settings() {
        return settings;
    }

    public RawEntitySet parse(String text) {
        try {
            return parse(LineSource.of(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public RawEntitySet parse(LineSource source) throws IOException {
        try (BufferedReader reader = source.open()) {
            Run run = new Run();
            String line;
            while ((line = reader.readLine()) != null) {
                run.accept(line);
            }
            return run.finish();
        }
    }

    public RawEntitySet parse(List<String> lines) {
        Run run = new Run();
        lines.forEach(run::accept);
        return run.finish();
    }

    /**
     * State of a single parse.
     */
    private final class Run {
        private final OntologyHeader.Builder header = new OntologyHeader.Builder();
        private final List<Typedef> typedefs = new ArrayList<>();
        private final List<Term> terms = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Set<String> reportedTags = new HashSet<>();

        private State state = State.HEADER;
        private String namespace;
        private int lineNo;
        private int stanzaLine;
        private Term.Builder term;
        private Typedef.Builder typedef;

        void accept(String raw) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("!")) return;

            if (line.startsWith("[") && line.endsWith("]")) {
                startStanza(line.substring(1, line.length() - 1).strip());
                return;
            }
            if (state == State.IN_UNKNOWN) return;

            Optional<TagValue> parsed = TagValue.parse(line);
            if (parsed.isEmpty()) {
                malformed(line, "Line does not match 'tag: value'");
                return;
            }
            TagValue tv = parsed.get();
            switch (state) {
                case HEADER -> header.add(tv.tag(), tv.value());
                case IN_TERM -> termLine(tv, line);
                case IN_TYPEDEF -> typedefLine(tv, line);
                default -> { }
            }
        }

        private void startStanza(String type) {
            finishStanza();
            if (namespace == null) {
                namespace = header.defaultNamespace().orElse(settings.defaultNamespace());
            }
            stanzaLine = lineNo;
            if (TERM.equals(type)) {
                state = State.IN_TERM;
                term = Term.builder();
            } else if (TYPEDEF.equals(type)) {
                state = State.IN_TYPEDEF;
                typedef = Typedef.builder();
            } else {
                state = State.IN_UNKNOWN;
                diagnostics.add(new Diagnostic(Kind.UNKNOWN_STANZA, lineNo, type, "Skipped [" + type + "] stanza"));
            }
        }

        private void termLine(TagValue tv, String line) {
            switch (tv.tag()) {
                case "id" -> {
                    if (term.id() != null) {
                        malformed(line, "Second id tag in stanza");
                    } else if (tv.firstToken().isEmpty()) {
                        malformed(line, "Empty id");
                    } else {
                        term.id(tv.firstToken());
                    }
                }
                case "name" -> term.name(tv.value());
                case "namespace" -> term.namespace(tv.value());
                case "def" -> term.definition(Definition.parse(tv.value()));
                case "is_a" -> {
                    if (tv.firstToken().isEmpty()) malformed(line, "is_a without a parent id");
                    else term.addIsA(tv.firstToken());
                }
                case "relationship" -> relationshipLine(tv, line);
                case "is_obsolete" -> term.obsolete(Boolean.parseBoolean(tv.value()));
                default -> {
                    if (settings.keepUnknownTags()) term.addAnnotation(tv.tag(), tv.value());
                    unknownTag(TERM, tv.tag());
                }
            }
        }

        private void relationshipLine(TagValue tv, String line) {
            String[] parts = tv.unqualifiedValue().split("\\s+", 2);
            if (parts.length < 2 || parts[1].isBlank()) {
                malformed(line, "relationship needs a typedef id and a target id");
                return;
            }
            String typedefId = parts[0].endsWith(":") ? parts[0].substring(0, parts[0].length() - 1) : parts[0];
            term.addRelationship(typedefId, parts[1].strip());
        }

        private void typedefLine(TagValue tv, String line) {
            switch (tv.tag()) {
                case "id" -> {
                    if (typedef.id() != null) {
                        malformed(line, "Second id tag in stanza");
                    } else if (tv.firstToken().isEmpty()) {
                        malformed(line, "Empty id");
                    } else {
                        typedef.id(tv.firstToken());
                    }
                }
                case "name" -> typedef.name(tv.value());
                case "def" -> typedef.definition(Definition.parse(tv.value()));
                case "inverse_of" -> {
                    if (tv.firstToken().isEmpty()) malformed(line, "inverse_of without a typedef id");
                    else typedef.inverseOf(tv.firstToken());
                }
                case "is_obsolete" -> typedef.obsolete(Boolean.parseBoolean(tv.value()));
                default -> {
                    if (settings.keepUnknownTags()) typedef.addAnnotation(tv.tag(), tv.value());
                    unknownTag(TYPEDEF, tv.tag());
                }
            }
        }

        private void finishStanza() {
            if (state == State.IN_TERM) {
                if (term.id() == null) {
                    throw new OboParseException("Stanza is missing the required 'id' tag", stanzaLine, TERM);
                }
                if (!term.hasNamespace()) term.namespace(namespace);
                terms.add(term.build());
            } else if (state == State.IN_TYPEDEF) {
                if (typedef.id() == null) {
                    throw new OboParseException("Stanza is missing the required 'id' tag", stanzaLine, TYPEDEF);
                }
                typedefs.add(typedef.build());
            }
            term = null;
            typedef = null;
        }

        private void malformed(String line, String message) {
            String stanza = switch (state) {
                case IN_TERM -> TERM;
                case IN_TYPEDEF -> TYPEDEF;
                default -> null;
            };
            if (settings.strict()) {
                throw new OboParseException(message + ": " + line, lineNo, stanza);
            }
            diagnostics.add(new Diagnostic(Kind.MALFORMED_LINE, lineNo, line, message));
        }

        // recorded once per stanza type and tag, so large files do not flood the list
        private void unknownTag(String stanzaType, String tag) {
            if (reportedTags.add(stanzaType + ":" + tag)) {
                diagnostics.add(new Diagnostic(Kind.UNKNOWN_TAG, lineNo, tag,
                        "Tag '" + tag + "' is not interpreted in [" + stanzaType + "] stanzas"));
            }
        }

        RawEntitySet finish() {
            finishStanza();
            if (namespace == null) {
                namespace = header.defaultNamespace().orElse(settings.defaultNamespace());
            }
            LOG.debugf("Parsed %d lines: %d terms, %d typedefs, %d diagnostics",
                    lineNo, terms.size(), typedefs.size(), diagnostics.size());
            return new RawEntitySet(header.build(), namespace, typedefs, terms, diagnostics);
        }
    }
}
