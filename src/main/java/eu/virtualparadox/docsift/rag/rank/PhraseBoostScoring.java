package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.rag.match.MatchCandidate;

/**
 * Decorator adding a fixed boost when the candidate text contains the query terms as a
 * consecutive phrase (see {@link eu.virtualparadox.docsift.rag.match.QueryTerms#containsPhrase(String)}).
 */
public final class PhraseBoostScoring implements ScoringFunction {

    private final ScoringFunction delegate;
    private final double boost;

    public PhraseBoostScoring(final ScoringFunction delegate, final double boost) {
        if (boost < 0 || Double.isNaN(boost) || Double.isInfinite(boost)) {
            throw new IllegalArgumentException("boost must be a finite, non-negative number");
        }
        this.delegate = delegate;
        this.boost = boost;
    }

    @Override
    public double score(final MatchCandidate candidate, final ScoringContext context) {
        final double base = delegate.score(candidate, context);
        return context.query().containsPhrase(candidate.text()) ? base + boost : base;
    }
}
