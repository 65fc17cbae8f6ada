package eu.virtualparadox.docsift.rag.index;

import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.catalog.model.Document;
import eu.virtualparadox.docsift.catalog.service.ContentStore;
import eu.virtualparadox.docsift.ingest.chunker.Chunker;
import eu.virtualparadox.docsift.ingest.model.Chunk;
import eu.virtualparadox.docsift.query.cache.ResponseCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orchestrates a corpus (re)load:
 * <ol>
 *     <li>Read every category directory through {@link ContentStore}</li>
 *     <li>Chunk each document with {@link Chunker}</li>
 *     <li>Build one {@link InvertedIndex} per category with {@link InvertedIndexBuilder}</li>
 *     <li>Validate the new snapshot, publish it through {@link CorpusRegistry} and purge cached responses</li>
 * </ol>
 * <p>
 * The next snapshot is built off to the side; the published one is only replaced after the build
 * and validation succeeded, so a failed reload leaves the previous index serving queries.
 * Loads are serialized; queries never wait for a load.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CorpusIndexService {

    private final ContentStore contentStore;
    private final Chunker chunker;
    private final InvertedIndexBuilder indexBuilder;
    private final CorpusRegistry registry;
    private final ResponseCache responseCache;

    /**
     * Loads (or reloads) the corpus rooted at {@code root}.
     *
     * @param root corpus root directory
     * @return handle to the newly published snapshot
     * @throws IOException if {@code root} is not a readable directory
     */
    public synchronized CorpusHandle loadCorpus(final Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            throw new NoSuchFileException(String.valueOf(root), null, "Corpus root not found");
        }
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }

        final long started = System.nanoTime();
        final long version = registry.find().map(CorpusSnapshot::version).orElse(0L) + 1;

        final Map<ECategory, CategoryIndex> categories = new EnumMap<>(ECategory.class);
        for (ECategory category : ECategory.values()) {
            categories.put(category, indexCategory(root, category));
        }

        final CorpusSnapshot snapshot = new CorpusSnapshot(version, Instant.now(), root, categories);
        snapshot.validate();

        registry.publish(snapshot);
        responseCache.invalidateAll();

        log.info("Published corpus version {} from {}: {} documents, {} chunks in {} ms",
                version, root, snapshot.documentCount(), snapshot.chunkCount(),
                (System.nanoTime() - started) / 1_000_000);
        return new CorpusHandle(snapshot);
    }

    /**
     * Handle for the currently published snapshot.
     *
     * @throws IndexNotReadyException if no corpus has been loaded yet
     */
    public CorpusHandle currentHandle() {
        return new CorpusHandle(registry.current());
    }

    private CategoryIndex indexCategory(final Path root, final ECategory category) throws IOException {
        final Set<Document> documents = contentStore.load(root, category);

        final Map<String, List<Chunk>> chunks = new LinkedHashMap<>();
        final List<Chunk> allChunks = new ArrayList<>();
        for (Document document : documents) {
            final List<Chunk> documentChunks = chunker.chunk(document);
            chunks.put(document.id(), documentChunks);
            allChunks.addAll(documentChunks);
            log.debug("Chunked {} into {} chunks", document.id(), documentChunks.size());
        }

        final InvertedIndex index = indexBuilder.build(allChunks);
        log.debug("Indexed category {}: {} terms over {} chunks", category, index.terms().size(), index.chunkCount());
        return new CategoryIndex(category, documents, chunks, index);
    }
}
