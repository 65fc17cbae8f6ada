package eu.virtualparadox.docsift.query.cache;

import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.rag.rank.EResultGranularity;

import java.util.List;
import java.util.Objects;

/**
 * Identity of a memoized response.
 *
 * @param query       normalized query (analyzed terms joined by a single space)
 * @param mentions    file stems the raw query mentions, sorted; empty when file-name matching is off
 * @param category    searched category
 * @param k           requested result count
 * @param granularity chunk or document results
 * @param version     corpus version the response was computed against
 */
public record CacheKey(String query,
                       List<String> mentions,
                       ECategory category,
                       int k,
                       EResultGranularity granularity,
                       long version) {

    public CacheKey {
        Objects.requireNonNull(query, "query must not be null");
        mentions = List.copyOf(mentions);
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(granularity, "granularity must not be null");
    }
}
