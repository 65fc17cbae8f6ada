package eu.virtualparadox.docsift.rag.rank;

/**
 * Unit of ranking: individual chunks, or whole documents with their chunk matches merged.
 */
public enum EResultGranularity {
    CHUNK,
    DOCUMENT
}
