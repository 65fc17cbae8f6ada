package eu.virtualparadox.docsift.ingest.model;

import java.util.Comparator;

/**
 * Location of a chunk: parent document id plus the chunk's position in that document.
 */
public record ChunkRef(String docId, int chunkIndex) implements Comparable<ChunkRef> {

    private static final Comparator<ChunkRef> ORDER = Comparator.comparing(ChunkRef::docId)
            .thenComparingInt(ChunkRef::chunkIndex);

    @Override
    public int compareTo(final ChunkRef other) {
        return ORDER.compare(this, other);
    }
}
