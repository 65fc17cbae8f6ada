package eu.virtualparadox.docsift.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the source text.
 * Used for paragraphs, sentences, tokens and windows.
 */
final class TextSpan {
    /**
     * Inclusive start offset into the source text.
     */
    final int start;
    /**
     * Exclusive end offset into the source text.
     */
    final int end;

    TextSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }
}
