package eu.virtualparadox.docsift.ingest.model;

/**
 * Immutable slice {@code [start, end)} of a document's text produced by the chunker.
 * <p>{@code docId} is a plain back-reference; the chunk does not own its document.</p>
 */
public record Chunk(String docId, int index, String text, int start, int end) {

    public String chunkId() {
        return docId + "_" + String.format("%05d", index);
    }

    public ChunkRef ref() {
        return new ChunkRef(docId, index);
    }
}
