package eu.virtualparadox.docsift.rag.index;

import eu.virtualparadox.docsift.ingest.model.ChunkRef;

/**
 * Occurrence of a term in one chunk.
 *
 * @param docId         parent document id
 * @param chunkIndex    chunk position within the document
 * @param termFrequency number of occurrences of the term in the chunk (&gt; 0)
 */
public record Posting(String docId, int chunkIndex, int termFrequency) {

    public Posting {
        if (termFrequency <= 0) {
            throw new IllegalArgumentException("termFrequency must be positive");
        }
    }

    public ChunkRef ref() {
        return new ChunkRef(docId, chunkIndex);
    }
}
