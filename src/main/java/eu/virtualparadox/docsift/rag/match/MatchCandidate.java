package eu.virtualparadox.docsift.rag.match;

import eu.virtualparadox.docsift.ingest.model.Chunk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A chunk (or a whole document) that contains at least one query term.
 *
 * @param docId            parent document id
 * @param chunk            matched chunk, or {@code null} for a document-level candidate
 * @param text             text forwarded with the result
 * @param termFrequencies  matched distinct query terms with their frequency in {@code text}
 */
public record MatchCandidate(String docId, Chunk chunk, String text, Map<String, Integer> termFrequencies) {

    public MatchCandidate {
        Objects.requireNonNull(docId, "docId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        termFrequencies = Collections.unmodifiableMap(new LinkedHashMap<>(termFrequencies));
    }

    /**
     * Chunk index used for ordering; {@code -1} for document-level candidates.
     */
    public int chunkIndex() {
        return chunk == null ? -1 : chunk.index();
    }

    public Set<String> matchedTerms() {
        return termFrequencies.keySet();
    }

    public int distinctTermCount() {
        return termFrequencies.size();
    }
}
