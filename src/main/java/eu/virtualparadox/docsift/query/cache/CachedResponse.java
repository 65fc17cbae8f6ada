package eu.virtualparadox.docsift.query.cache;

import eu.virtualparadox.docsift.rag.retriever.model.SearchResult;

import java.util.List;

/**
 * Memoized retrieval output, optionally with the answer produced from it.
 *
 * @param results ranked results, best first
 * @param answer  downstream answer text, {@code null} until one has been computed
 */
public record CachedResponse(List<SearchResult> results, String answer) {

    public CachedResponse {
        results = List.copyOf(results);
    }

    public static CachedResponse of(final List<SearchResult> results) {
        return new CachedResponse(results, null);
    }

    public CachedResponse withAnswer(final String answer) {
        return new CachedResponse(results, answer);
    }

    public boolean hasAnswer() {
        return answer != null;
    }
}
