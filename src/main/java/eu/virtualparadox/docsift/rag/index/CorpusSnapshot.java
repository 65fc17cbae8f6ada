package eu.virtualparadox.docsift.rag.index;

import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.catalog.model.Document;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, fully built corpus: one {@link CategoryIndex} per category. Published as a whole
 * by {@link CorpusRegistry}; readers never observe a partially built snapshot.
 */
public final class CorpusSnapshot {

    private final long version;
    private final Instant loadedAt;
    private final Path root;
    private final Map<ECategory, CategoryIndex> categories;

    public CorpusSnapshot(final long version,
                          final Instant loadedAt,
                          final Path root,
                          final Map<ECategory, CategoryIndex> categories) {
        this.version = version;
        this.loadedAt = loadedAt;
        this.root = root;
        final Map<ECategory, CategoryIndex> copy = new EnumMap<>(ECategory.class);
        for (ECategory category : ECategory.values()) {
            copy.put(category, categories.getOrDefault(category, CategoryIndex.empty(category)));
        }
        this.categories = Collections.unmodifiableMap(copy);
    }

    public long version() {
        return version;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public Path root() {
        return root;
    }

    public CategoryIndex category(final ECategory category) {
        return categories.get(category);
    }

    public Optional<Document> document(final String docId) {
        for (CategoryIndex categoryIndex : categories.values()) {
            final Optional<Document> document = categoryIndex.document(docId);
            if (document.isPresent()) {
                return document;
            }
        }
        return Optional.empty();
    }

    public int documentCount() {
        return categories.values().stream().mapToInt(c -> c.documents().size()).sum();
    }

    public int chunkCount() {
        return categories.values().stream().mapToInt(CategoryIndex::chunkCount).sum();
    }

    /**
     * @throws IllegalStateException if any category violates the posting invariants
     */
    public void validate() {
        categories.values().forEach(CategoryIndex::validate);
    }
}
