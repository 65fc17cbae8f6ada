package eu.virtualparadox.docsift.rag.index;

import eu.virtualparadox.docsift.ingest.model.Chunk;
import eu.virtualparadox.docsift.ingest.model.ChunkRef;
import eu.virtualparadox.docsift.rag.analysis.TermExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds an {@link InvertedIndex} in a single linear pass over chunk text.
 * <p>For each chunk the terms are counted once; every distinct term gets one posting carrying
 * its in-chunk frequency. Posting lists are not sorted; ranking does not depend on their order.</p>
 */
@Component
@RequiredArgsConstructor
public class InvertedIndexBuilder {

    private final TermExtractor termExtractor;

    /**
     * @param chunks chunks of one or more documents; each {@code (docId, index)} at most once
     * @return immutable index over {@code chunks}
     * @throws IllegalArgumentException if the same chunk location appears twice
     */
    public InvertedIndex build(final Collection<Chunk> chunks) {
        final Map<String, List<Posting>> postings = new HashMap<>();
        final Set<ChunkRef> seen = new HashSet<>();

        for (Chunk chunk : chunks) {
            if (!seen.add(chunk.ref())) {
                throw new IllegalArgumentException("Duplicate chunk: " + chunk.chunkId());
            }
            final Map<String, Integer> frequencies = termExtractor.termFrequencies(chunk.text());
            for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
                postings.computeIfAbsent(entry.getKey(), term -> new ArrayList<>())
                        .add(new Posting(chunk.docId(), chunk.index(), entry.getValue()));
            }
        }
        return new InvertedIndex(postings, seen.size());
    }
}
