package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.rag.match.MatchCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Top-k selection over scored candidates.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>A bounded {@link PriorityQueue} of capacity {@code k} keeps the best candidates seen so far,
 *       with the worst of them at the head.</li>
 *   <li>Each candidate is offered once: while the queue is not full it is added; afterwards it
 *       replaces the head only if it ranks strictly better.</li>
 *   <li>The survivors are returned best first according to {@link ScoredCandidate#RANKING}; the
 *       document id / chunk index tie-break makes the output independent of input order.</li>
 * </ul>
 * Selection is {@code O(n log k)}; no candidate ranking better than a returned one is ever dropped.
 */
@Component
public class Ranker {

    /**
     * Scores {@code matches} and selects the best {@code k}.
     *
     * @param matches candidates to score
     * @param k       maximum number of results ({@code >= 0})
     * @param scoring scoring function
     * @param context query-scoped scoring inputs
     * @return at most {@code k} candidates, best first
     * @throws IllegalArgumentException if {@code k < 0}
     */
    public List<ScoredCandidate> rank(final Collection<MatchCandidate> matches,
                                      final int k,
                                      final ScoringFunction scoring,
                                      final ScoringContext context) {
        final List<ScoredCandidate> scored = new ArrayList<>(matches.size());
        for (MatchCandidate match : matches) {
            scored.add(new ScoredCandidate(match, scoring.score(match, context)));
        }
        return rank(scored, k);
    }

    /**
     * Selects the best {@code k} of already scored candidates.
     *
     * @param candidates scored candidates
     * @param k          maximum number of results ({@code >= 0})
     * @return at most {@code k} candidates, best first
     * @throws IllegalArgumentException if {@code k < 0}
     */
    public List<ScoredCandidate> rank(final Collection<ScoredCandidate> candidates, final int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        if (k == 0 || candidates.isEmpty()) {
            return List.of();
        }

        // head = worst retained candidate
        final PriorityQueue<ScoredCandidate> queue =
                new PriorityQueue<>(Math.min(k, candidates.size()), ScoredCandidate.RANKING.reversed());

        for (ScoredCandidate candidate : candidates) {
            if (queue.size() < k) {
                queue.add(candidate);
            } else if (ScoredCandidate.RANKING.compare(candidate, queue.peek()) < 0) {
                queue.poll();
                queue.add(candidate);
            }
        }

        final List<ScoredCandidate> result = new ArrayList<>(queue);
        result.sort(ScoredCandidate.RANKING);
        return List.copyOf(result);
    }
}
