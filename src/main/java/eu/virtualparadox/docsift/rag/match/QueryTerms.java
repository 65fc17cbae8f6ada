package eu.virtualparadox.docsift.rag.match;

import eu.virtualparadox.docsift.rag.analysis.TermCharacters;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed query: the raw text, its distinct normalized terms in first-occurrence order,
 * and an automaton over those terms for raw-text scans.
 */
public final class QueryTerms {

    private final String raw;
    private final List<String> terms;
    private final TermAutomaton automaton;

    public QueryTerms(final String raw, final List<String> terms) {
        this.raw = raw == null ? "" : raw;
        this.terms = List.copyOf(terms);
        this.automaton = TermAutomaton.of(this.terms);
    }

    public String raw() {
        return raw;
    }

    public List<String> terms() {
        return terms;
    }

    public TermAutomaton automaton() {
        return automaton;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /**
     * Canonical form used as a cache key: terms joined by single spaces.
     */
    public String normalized() {
        return String.join(" ", terms);
    }

    /**
     * Whether {@code text} contains all query terms consecutively and in query order, separated
     * only by non-term characters. Single-term queries never form a phrase.
     *
     * @param text candidate text
     * @return {@code true} if the phrase occurs at least once
     */
    public boolean containsPhrase(final String text) {
        if (terms.size() < 2 || text == null) {
            return false;
        }

        final Map<Integer, List<TermAutomaton.Hit>> hitsByStart = new HashMap<>();
        final List<TermAutomaton.Hit> hits = automaton.scan(text);
        for (TermAutomaton.Hit hit : hits) {
            hitsByStart.computeIfAbsent(hit.start(), s -> new ArrayList<>()).add(hit);
        }

        for (TermAutomaton.Hit hit : hits) {
            if (hit.pattern().equals(terms.get(0)) && continuesPhrase(text, hit.end(), 1, hitsByStart)) {
                return true;
            }
        }
        return false;
    }

    private boolean continuesPhrase(final String text,
                                    final int position,
                                    final int termIndex,
                                    final Map<Integer, List<TermAutomaton.Hit>> hitsByStart) {
        if (termIndex == terms.size()) {
            return true;
        }
        int next = position;
        while (next < text.length() && !TermCharacters.isTermCharAt(text, next)) {
            next++;
        }
        for (TermAutomaton.Hit hit : hitsByStart.getOrDefault(next, List.of())) {
            if (hit.pattern().equals(terms.get(termIndex))
                    && continuesPhrase(text, hit.end(), termIndex + 1, hitsByStart)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "QueryTerms" + terms;
    }
}
