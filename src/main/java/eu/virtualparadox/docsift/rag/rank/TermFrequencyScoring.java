package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.rag.match.MatchCandidate;

/**
 * Score = total number of query term occurrences in the candidate.
 */
public final class TermFrequencyScoring implements ScoringFunction {

    @Override
    public double score(final MatchCandidate candidate, final ScoringContext context) {
        return candidate.termFrequencies().values().stream().mapToInt(Integer::intValue).sum();
    }
}
