package eu.virtualparadox.docsift.rag.index;

import java.time.Instant;
import java.util.Objects;

/**
 * Handle to one published corpus version. A new handle is issued on every successful load;
 * queries made through a handle always run against the snapshot it was issued for.
 */
public final class CorpusHandle {

    private final CorpusSnapshot snapshot;

    public CorpusHandle(final CorpusSnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot must not be null");
    }

    public long version() {
        return snapshot.version();
    }

    public Instant loadedAt() {
        return snapshot.loadedAt();
    }

    public int documentCount() {
        return snapshot.documentCount();
    }

    public int chunkCount() {
        return snapshot.chunkCount();
    }

    public CorpusSnapshot snapshot() {
        return snapshot;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof CorpusHandle other && other.snapshot == snapshot;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(snapshot);
    }

    @Override
    public String toString() {
        return "CorpusHandle{version=" + version() + ", documents=" + documentCount()
                + ", chunks=" + chunkCount() + "}";
    }
}
