package eu.virtualparadox.docsift.rag.index;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published {@link CorpusSnapshot}. Readers dereference the pointer once per
 * query; a reload replaces it with a single atomic write.
 */
@Component
public class CorpusRegistry {

    private final AtomicReference<CorpusSnapshot> current = new AtomicReference<>();

    /**
     * @return the published snapshot
     * @throws IndexNotReadyException if nothing has been published yet
     */
    public CorpusSnapshot current() {
        final CorpusSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IndexNotReadyException();
        }
        return snapshot;
    }

    public Optional<CorpusSnapshot> find() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Publishes {@code snapshot}, replacing the previous one.
     *
     * @return the replaced snapshot, if any
     */
    public Optional<CorpusSnapshot> publish(final CorpusSnapshot snapshot) {
        return Optional.ofNullable(current.getAndSet(snapshot));
    }
}
