package eu.virtualparadox.docsift.rag.index;

/**
 * Thrown when a query arrives before the first corpus load succeeded. Retryable.
 */
public class IndexNotReadyException extends IllegalStateException {

    public IndexNotReadyException() {
        super("Corpus index is not ready; no corpus has been loaded yet");
    }
}
