package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.rag.match.MatchCandidate;

/**
 * Scores one candidate for one query. Implementations are stateless and deterministic;
 * scores must be finite and non-negative.
 */
@FunctionalInterface
public interface ScoringFunction {

    double score(final MatchCandidate candidate, final ScoringContext context);
}
