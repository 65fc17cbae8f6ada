package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.rag.match.MatchCandidate;

/**
 * Score = number of distinct query terms the candidate contains.
 */
public final class DistinctTermScoring implements ScoringFunction {

    @Override
    public double score(final MatchCandidate candidate, final ScoringContext context) {
        return candidate.distinctTermCount();
    }
}
