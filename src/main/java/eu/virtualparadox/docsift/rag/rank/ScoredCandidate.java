package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.rag.match.MatchCandidate;

import java.util.Comparator;
import java.util.Objects;

/**
 * A candidate with its query-scoped score.
 */
public record ScoredCandidate(MatchCandidate candidate, double score) {

    /**
     * Ranking order, best first: higher score, then document id ascending, then chunk index ascending.
     */
    public static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingDouble(ScoredCandidate::score).reversed()
            .thenComparing(scored -> scored.candidate().docId())
            .thenComparingInt(scored -> scored.candidate().chunkIndex());

    public ScoredCandidate {
        Objects.requireNonNull(candidate, "candidate must not be null");
        if (score < 0 || Double.isNaN(score) || Double.isInfinite(score)) {
            throw new IllegalArgumentException("score must be a finite, non-negative number: " + score);
        }
    }
}
