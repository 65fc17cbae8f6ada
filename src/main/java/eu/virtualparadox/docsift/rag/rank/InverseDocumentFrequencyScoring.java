package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.rag.index.InvertedIndex;
import eu.virtualparadox.docsift.rag.match.MatchCandidate;

/**
 * Weights each distinct matched term by its rarity across the category's chunks:
 * <pre>
 *     score = Σ (1 + ln(N / df(term)))
 * </pre>
 * where {@code N} is the chunk count and {@code df} the number of chunks containing the term
 * (at least 1, so terms outside the index, such as file-name mentions, get the maximum weight).
 * Every matched term contributes at least 1, so a candidate never scores below its distinct
 * term count.
 */
public final class InverseDocumentFrequencyScoring implements ScoringFunction {

    @Override
    public double score(final MatchCandidate candidate, final ScoringContext context) {
        final InvertedIndex index = context.index();
        final int chunkCount = Math.max(1, index.chunkCount());

        double score = 0.0;
        for (String term : candidate.matchedTerms()) {
            final int frequency = Math.min(chunkCount, Math.max(1, index.chunkFrequency(term)));
            score += 1.0 + Math.log((double) chunkCount / frequency);
        }
        return score;
    }
}
