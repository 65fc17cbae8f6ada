package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.rag.index.InvertedIndex;
import eu.virtualparadox.docsift.rag.match.QueryTerms;

/**
 * Query-scoped inputs available to a {@link ScoringFunction}.
 *
 * @param query parsed query
 * @param index index of the searched category, for collection statistics
 */
public record ScoringContext(QueryTerms query, InvertedIndex index) {
}
