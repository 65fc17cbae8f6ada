package eu.virtualparadox.docsift.rag.match;

/**
 * How candidate chunks are found.
 */
public enum EMatchStrategy {
    /**
     * Posting-list lookups in the inverted index.
     */
    INDEX,
    /**
     * One automaton pass over the raw text of every chunk of the category.
     */
    SCAN
}
