package eu.virtualparadox.docsift.rag.retriever.model;

/**
 * @param docId    Identifier of the parent document ({@code <category-dir>/<file-name>}).
 * @param fileName File name of the parent document.
 * @param chunkId  Identifier of the chunk inside the document, {@code null} for a whole-document result.
 * @param text     The chunk text, or the full document text for a whole-document result.
 * @param start    Start offset of {@code text} in the document (inclusive).
 * @param end      End offset of {@code text} in the document (exclusive).
 * @param score    Relevance score (higher = better).
 */
public record SearchResult(String docId, String fileName, String chunkId, String text, int start, int end, double score) {

}
