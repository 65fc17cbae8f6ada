package eu.virtualparadox.docsift.rag.match;

import eu.virtualparadox.docsift.rag.analysis.TermCharacters;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aho-Corasick automaton over a fixed set of patterns.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Build:</strong> patterns are inserted into a trie, then failure links are computed
 *       breadth-first. Each node's output set is extended with the outputs of its failure target,
 *       so a single visit reports every pattern ending at that position.</li>
 *   <li><strong>Scan:</strong> one left-to-right pass over the text, {@code O(text + hits)},
 *       independent of the number of patterns.</li>
 *   <li><strong>Matching rules:</strong> comparison is case-insensitive (per-character lower-casing,
 *       which keeps offsets aligned with the input) and only whole-word occurrences are reported:
 *       the characters directly before and after a hit must not be {@link TermCharacters term characters}.</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class TermAutomaton {

    private static final int ROOT = 0;

    private final List<Map<Character, Integer>> transitions;
    private final int[] failure;
    private final List<List<String>> outputs;
    private final Set<String> patterns;

    /**
     * A whole-word occurrence of {@code pattern} at {@code [start, end)} of the scanned text.
     */
    public record Hit(String pattern, int start, int end) {
    }

    private TermAutomaton(final List<Map<Character, Integer>> transitions,
                          final int[] failure,
                          final List<List<String>> outputs,
                          final Set<String> patterns) {
        this.transitions = transitions;
        this.failure = failure;
        this.outputs = outputs;
        this.patterns = patterns;
    }

    /**
     * Builds an automaton. Patterns are lower-cased; blank patterns are ignored.
     *
     * @param patterns patterns to search for
     * @return immutable automaton (possibly empty)
     */
    public static TermAutomaton of(final Collection<String> patterns) {
        final Set<String> normalized = new LinkedHashSet<>();
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isBlank()) {
                normalized.add(lowerCase(pattern));
            }
        }

        final List<Map<Character, Integer>> transitions = new ArrayList<>();
        final List<List<String>> outputs = new ArrayList<>();
        transitions.add(new HashMap<>());
        outputs.add(new ArrayList<>());

        for (String pattern : normalized) {
            int state = ROOT;
            for (int i = 0; i < pattern.length(); i++) {
                final char c = pattern.charAt(i);
                Integer next = transitions.get(state).get(c);
                if (next == null) {
                    next = transitions.size();
                    transitions.add(new HashMap<>());
                    outputs.add(new ArrayList<>());
                    transitions.get(state).put(c, next);
                }
                state = next;
            }
            outputs.get(state).add(pattern);
        }

        final int[] failure = new int[transitions.size()];
        final Deque<Integer> queue = new ArrayDeque<>();
        for (int child : transitions.get(ROOT).values()) {
            failure[child] = ROOT;
            queue.add(child);
        }

        while (!queue.isEmpty()) {
            final int node = queue.poll();
            for (Map.Entry<Character, Integer> edge : transitions.get(node).entrySet()) {
                final char c = edge.getKey();
                final int child = edge.getValue();

                int fallback = failure[node];
                while (fallback != ROOT && !transitions.get(fallback).containsKey(c)) {
                    fallback = failure[fallback];
                }
                failure[child] = transitions.get(fallback).getOrDefault(c, ROOT);
                outputs.get(child).addAll(outputs.get(failure[child]));
                queue.add(child);
            }
        }

        final List<Map<Character, Integer>> frozenTransitions = new ArrayList<>(transitions.size());
        for (Map<Character, Integer> edges : transitions) {
            frozenTransitions.add(Map.copyOf(edges));
        }
        final List<List<String>> frozenOutputs = new ArrayList<>(outputs.size());
        for (List<String> output : outputs) {
            frozenOutputs.add(List.copyOf(output));
        }

        return new TermAutomaton(
                Collections.unmodifiableList(frozenTransitions),
                failure,
                Collections.unmodifiableList(frozenOutputs),
                Collections.unmodifiableSet(normalized));
    }

    public Set<String> patterns() {
        return patterns;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * Scans {@code text} once and reports all whole-word pattern occurrences.
     *
     * @param text text to scan; {@code null} is treated as empty
     * @return hits ordered by end offset, longer patterns first for a shared end
     */
    public List<Hit> scan(final CharSequence text) {
        final List<Hit> hits = new ArrayList<>();
        if (text == null || patterns.isEmpty()) {
            return hits;
        }

        int state = ROOT;
        for (int i = 0; i < text.length(); i++) {
            final char c = Character.toLowerCase(text.charAt(i));
            while (state != ROOT && !transitions.get(state).containsKey(c)) {
                state = failure[state];
            }
            state = transitions.get(state).getOrDefault(c, ROOT);

            for (String pattern : outputs.get(state)) {
                final int start = i + 1 - pattern.length();
                final int end = i + 1;
                if (!TermCharacters.isTermCharBefore(text, start) && !TermCharacters.isTermCharAt(text, end)) {
                    hits.add(new Hit(pattern, start, end));
                }
            }
        }
        return hits;
    }

    /**
     * Distinct patterns occurring in {@code text}, in order of first occurrence.
     */
    public Set<String> find(final CharSequence text) {
        final Set<String> found = new LinkedHashSet<>();
        for (Hit hit : scan(text)) {
            found.add(hit.pattern());
        }
        return found;
    }

    private static String lowerCase(final String value) {
        final StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            sb.append(Character.toLowerCase(value.charAt(i)));
        }
        return sb.toString();
    }
}
