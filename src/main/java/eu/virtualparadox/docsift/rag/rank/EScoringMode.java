package eu.virtualparadox.docsift.rag.rank;

/**
 * Built-in scoring functions selectable through configuration.
 */
public enum EScoringMode {
    DISTINCT_TERMS,
    TERM_FREQUENCY,
    INVERSE_DOCUMENT_FREQUENCY;

    public ScoringFunction function() {
        return switch (this) {
            case DISTINCT_TERMS -> new DistinctTermScoring();
            case TERM_FREQUENCY -> new TermFrequencyScoring();
            case INVERSE_DOCUMENT_FREQUENCY -> new InverseDocumentFrequencyScoring();
        };
    }
}
