package com.e2eq.obo.core;

import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the current version of an ontology that other ontologies get merged into over time.
 * Readers always see a complete ontology; merges run one at a time and swap the result in
 * atomically, bumping an observable version number.
 */
public final class VersionedOntology implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(VersionedOntology.class);

    private final AtomicReference<Ontology> current;
    private final ReentrantLock writeLock = new ReentrantLock();

    // observable version
    private final AtomicLong version = new AtomicLong(1L);
    private final SubmissionPublisher<Long> publisher = new SubmissionPublisher<>();

    public VersionedOntology(Ontology initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public Ontology current() { return current.get(); }

    public long version() { return version.get(); }

    public String getHash() { return OntologyHasher.computeHash(current.get()); }

    public Flow.Publisher<Long> versionPublisher() { return publisher; }

    /**
     * Merges {@code other} into the current ontology, which keeps its metadata. On failure the
     * exception propagates and the current ontology and version are unchanged.
     */
    public Ontology mergeIn(Ontology other) {
        writeLock.lock();
        try {
            Ontology merged = OntologyMerger.merge(current.get(), other);
            current.set(merged);
            long v = bumpVersion();
            LOG.debugf("Ontology advanced to version %d (%d terms)", v, merged.size());
            return merged;
        } finally {
            writeLock.unlock();
        }
    }

    private long bumpVersion() {
        long v = version.incrementAndGet();
        // offer never blocks the writer; a subscriber that has fallen behind misses this version
        publisher.offer(v, (subscriber, dropped) -> {
            LOG.debugf("Dropped version %d for a lagging subscriber", dropped);
            return false;
        });
        return v;
    }

    @Override
    public void close() {
        publisher.close();
    }
}
