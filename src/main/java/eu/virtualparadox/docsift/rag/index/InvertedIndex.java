package eu.virtualparadox.docsift.rag.index;

import eu.virtualparadox.docsift.ingest.model.ChunkRef;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable inverted index: term → postings.
 * <p>
 * Invariants:
 * <ul>
 *   <li>a term is present iff it has at least one posting</li>
 *   <li>a term has at most one posting per {@code (docId, chunkIndex)}</li>
 * </ul>
 * Equality compares postings per term as sets, so two indexes built from the same chunks in a
 * different order are equal.
 */
public final class InvertedIndex {

    private static final InvertedIndex EMPTY = new InvertedIndex(Map.of(), 0);

    private final Map<String, List<Posting>> postings;
    private final int chunkCount;

    InvertedIndex(final Map<String, List<Posting>> postings, final int chunkCount) {
        final Map<String, List<Posting>> copy = new HashMap<>(postings.size());
        postings.forEach((term, list) -> copy.put(term, List.copyOf(list)));
        this.postings = Collections.unmodifiableMap(copy);
        this.chunkCount = chunkCount;
    }

    public static InvertedIndex empty() {
        return EMPTY;
    }

    /**
     * @param term normalized term
     * @return postings for {@code term}, empty if the term is not indexed
     */
    public List<Posting> postings(final String term) {
        return postings.getOrDefault(term, List.of());
    }

    public boolean contains(final String term) {
        return postings.containsKey(term);
    }

    public Set<String> terms() {
        return postings.keySet();
    }

    /**
     * Number of chunks the index was built from, including chunks without any term.
     */
    public int chunkCount() {
        return chunkCount;
    }

    /**
     * Number of chunks containing {@code term}.
     */
    public int chunkFrequency(final String term) {
        return postings(term).size();
    }

    /**
     * Checks that every posting refers to one of {@code chunks} and that no posting list is empty
     * or holds two postings for the same chunk.
     *
     * @param chunks locations that exist in the owning snapshot
     * @throws IllegalStateException on the first violation
     */
    public void validate(final Set<ChunkRef> chunks) {
        for (Map.Entry<String, List<Posting>> entry : postings.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new IllegalStateException("Empty posting list for term: " + entry.getKey());
            }
            final Set<ChunkRef> seen = new HashSet<>();
            for (Posting posting : entry.getValue()) {
                if (!chunks.contains(posting.ref())) {
                    throw new IllegalStateException("Posting for term '" + entry.getKey()
                            + "' references unknown chunk " + posting.ref());
                }
                if (!seen.add(posting.ref())) {
                    throw new IllegalStateException("Duplicate posting for term '" + entry.getKey()
                            + "' at " + posting.ref());
                }
            }
        }
    }

    private Map<String, Set<Posting>> asSets() {
        final Map<String, Set<Posting>> sets = new HashMap<>(postings.size());
        postings.forEach((term, list) -> sets.put(term, new HashSet<>(list)));
        return sets;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InvertedIndex other)) {
            return false;
        }
        return chunkCount == other.chunkCount && asSets().equals(other.asSets());
    }

    @Override
    public int hashCode() {
        return Objects.hash(chunkCount, asSets());
    }

    @Override
    public String toString() {
        return "InvertedIndex{terms=" + postings.size() + ", chunks=" + chunkCount + "}";
    }
}
