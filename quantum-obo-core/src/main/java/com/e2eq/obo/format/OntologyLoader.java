package com.e2eq.obo.format;

import com.e2eq.obo.config.OboConfig;
import com.e2eq.obo.core.Diagnostic;
import com.e2eq.obo.core.GraphBuilder;
import com.e2eq.obo.core.Ontology;
import com.e2eq.obo.core.OntologyMerger;
import com.e2eq.obo.parser.ParserSettings;
import com.e2eq.obo.spi.FormatAdapter;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads an {@link Ontology} from a file, a classpath resource or a stream, choosing the
 * {@link FormatAdapter} by file extension.
 * <p>
 * Header {@code import:} entries naming local files are followed relative to the importing
 * file and merged into it, the importer's metadata winning. Imports that cannot be read are
 * reported as {@link Diagnostic.Kind#IMPORT_FAILED} diagnostics; remote imports are never fetched.
 * </p>
 */
public final class OntologyLoader {
    private static final Logger LOG = Logger.getLogger(OntologyLoader.class);

    private final List<FormatAdapter> adapters;
    private final boolean resolveImports;
    private final int importDepth;

    public OntologyLoader() {
        this(List.of(new OboFormatAdapter(), new YamlFormatAdapter()), true, -1);
    }

    public OntologyLoader(OboConfig config) {
        this(List.of(new OboFormatAdapter(ParserSettings.from(config.parser())), new YamlFormatAdapter()),
                config.loader().resolveImports(), config.loader().importDepth());
    }

    public OntologyLoader(List<FormatAdapter> adapters, boolean resolveImports, int importDepth) {
        if (adapters.isEmpty()) throw new IllegalArgumentException("At least one format adapter is required");
        this.adapters = List.copyOf(adapters);
        this.resolveImports = resolveImports;
        this.importDepth = importDepth;
    }

    /**
     * The adapter whose extensions match {@code fileName}; the first adapter when none does.
     */
    public FormatAdapter adapterFor(String fileName) {
        return adapters.stream().filter(a -> a.handles(fileName)).findFirst().orElse(adapters.get(0));
    }

    public Ontology loadFromPath(Path path) throws IOException {
        return load(new PathSource(path.toAbsolutePath().normalize()));
    }

    public Ontology loadFromClasspath(String resourcePath) throws IOException {
        return load(new ClasspathSource(resourcePath));
    }

    /**
     * Loads from a stream without resolving imports, which have no location to be relative to.
     */
    public Ontology load(InputStream in, FormatAdapter adapter) throws IOException {
        return GraphBuilder.build(adapter.parse(in));
    }

    private Ontology load(Source source) throws IOException {
        List<Diagnostic> importDiagnostics = new ArrayList<>();
        Set<String> visiting = new HashSet<>();
        Ontology root = load(source, importDepth, visiting, importDiagnostics);
        return root.withAdditionalDiagnostics(importDiagnostics);
    }

    private Ontology load(Source source, int depth, Set<String> visiting, List<Diagnostic> importDiagnostics)
            throws IOException {
        visiting.add(source.name());
        Ontology ontology;
        try (InputStream in = source.open()) {
            ontology = GraphBuilder.build(adapterFor(source.name()).parse(in));
        }
        LOG.debugf("Loaded %s: %s", source.name(), ontology);
        if (!resolveImports || depth == 0) return ontology;

        List<Diagnostic> own = ontology.diagnostics();
        Ontology result = ontology;
        for (String ref : ontology.header().imports()) {
            if (ref.contains("://")) {
                LOG.warnf("Skipping remote import %s of %s", ref, source.name());
                importDiagnostics.add(Diagnostic.of(Diagnostic.Kind.IMPORT_FAILED, ref, "Remote imports are not fetched"));
                continue;
            }
            Source imported = source.resolve(ref);
            if (visiting.contains(imported.name())) {
                LOG.debugf("Import %s of %s already being loaded", ref, source.name());
                continue;
            }
            try {
                result = OntologyMerger.merge(result, load(imported, depth - 1, visiting, importDiagnostics));
            } catch (IOException e) {
                LOG.warnf(e, "Could not import %s into %s", ref, source.name());
                importDiagnostics.add(Diagnostic.of(Diagnostic.Kind.IMPORT_FAILED, ref, String.valueOf(e.getMessage())));
            }
        }
        // merging starts a fresh diagnostics list; keep what the importer's own parse reported
        return result == ontology ? ontology : result.withAdditionalDiagnostics(own);
    }

    private interface Source {
        String name();

        InputStream open() throws IOException;

        Source resolve(String ref);
    }

    private record PathSource(Path path) implements Source {
        @Override
        public String name() { return path.toString(); }

        @Override
        public InputStream open() throws IOException { return Files.newInputStream(path); }

        @Override
        public Source resolve(String ref) {
            Path parent = path.getParent();
            Path target = parent == null ? Path.of(ref) : parent.resolve(ref);
            return new PathSource(target.toAbsolutePath().normalize());
        }
    }

    private record ClasspathSource(String resourcePath) implements Source {
        @Override
        public String name() { return resourcePath; }

        @Override
        public InputStream open() throws IOException {
            InputStream in = OntologyLoader.class.getResourceAsStream(resourcePath);
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return in;
        }

        @Override
        public Source resolve(String ref) {
            int slash = resourcePath.lastIndexOf('/');
            return new ClasspathSource(slash < 0 ? ref : resourcePath.substring(0, slash + 1) + ref);
        }
    }
}
