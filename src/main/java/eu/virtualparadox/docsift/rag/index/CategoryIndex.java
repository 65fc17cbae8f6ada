package eu.virtualparadox.docsift.rag.index;

import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.catalog.model.Document;
import eu.virtualparadox.docsift.ingest.model.Chunk;
import eu.virtualparadox.docsift.ingest.model.ChunkRef;
import eu.virtualparadox.docsift.rag.match.TermAutomaton;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable per-category slice of a corpus snapshot: documents, their chunks, the inverted index
 * over those chunks and an automaton over the documents' file stems.
 */
public final class CategoryIndex {

    private final ECategory category;
    private final Map<String, Document> documents;
    private final Map<String, List<Chunk>> chunks;
    private final InvertedIndex index;
    private final Map<String, Set<String>> documentsByStem;
    private final TermAutomaton fileNames;

    public CategoryIndex(final ECategory category,
                         final Collection<Document> documents,
                         final Map<String, List<Chunk>> chunks,
                         final InvertedIndex index) {
        this.category = category;

        final Map<String, Document> byId = new TreeMap<>();
        final Map<String, Set<String>> byStem = new TreeMap<>();
        for (Document document : documents) {
            byId.put(document.id(), document);
            byStem.computeIfAbsent(document.stem(), s -> new LinkedHashSet<>()).add(document.id());
        }
        this.documents = Collections.unmodifiableMap(byId);
        this.documentsByStem = Collections.unmodifiableMap(byStem);

        final Map<String, List<Chunk>> chunkCopy = new TreeMap<>();
        chunks.forEach((docId, list) -> chunkCopy.put(docId, List.copyOf(list)));
        this.chunks = Collections.unmodifiableMap(chunkCopy);

        this.index = index;
        this.fileNames = TermAutomaton.of(byStem.keySet());
    }

    public static CategoryIndex empty(final ECategory category) {
        return new CategoryIndex(category, List.of(), Map.of(), InvertedIndex.empty());
    }

    public ECategory category() {
        return category;
    }

    public InvertedIndex index() {
        return index;
    }

    public Map<String, Document> documents() {
        return documents;
    }

    public Optional<Document> document(final String docId) {
        return Optional.ofNullable(documents.get(docId));
    }

    public List<Chunk> chunks(final String docId) {
        return chunks.getOrDefault(docId, List.of());
    }

    public Optional<Chunk> chunk(final ChunkRef ref) {
        final List<Chunk> documentChunks = chunks(ref.docId());
        if (ref.chunkIndex() < 0 || ref.chunkIndex() >= documentChunks.size()) {
            return Optional.empty();
        }
        return Optional.of(documentChunks.get(ref.chunkIndex()));
    }

    public int chunkCount() {
        return chunks.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Documents whose file stem (file name without extension) occurs as a whole word in {@code text}.
     *
     * @param text raw query text
     * @return stem → ids of the documents carrying it, in first-mention order
     */
    public Map<String, Set<String>> documentsMentionedIn(final String text) {
        final Map<String, Set<String>> mentioned = new LinkedHashMap<>();
        for (String stem : fileNames.find(text)) {
            mentioned.put(stem, documentsByStem.getOrDefault(stem, Set.of()));
        }
        return mentioned;
    }

    /**
     * Verifies that postings only reference chunks of this category and that every chunk sits at
     * the position its index claims.
     *
     * @throws IllegalStateException on inconsistency
     */
    void validate() {
        final Set<ChunkRef> refs = new HashSet<>();
        for (Map.Entry<String, List<Chunk>> entry : chunks.entrySet()) {
            if (!documents.containsKey(entry.getKey())) {
                throw new IllegalStateException("Chunks for unknown document: " + entry.getKey());
            }
            final List<Chunk> list = entry.getValue();
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i).index() != i || !list.get(i).docId().equals(entry.getKey())) {
                    throw new IllegalStateException("Chunk out of place: " + list.get(i).chunkId());
                }
                refs.add(list.get(i).ref());
            }
        }
        index.validate(refs);
    }
}
