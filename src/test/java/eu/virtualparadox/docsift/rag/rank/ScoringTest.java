package eu.virtualparadox.docsift.rag.rank;

import eu.virtualparadox.docsift.ingest.model.Chunk;
import eu.virtualparadox.docsift.rag.analysis.TermAnalyzer;
import eu.virtualparadox.docsift.rag.analysis.TermExtractor;
import eu.virtualparadox.docsift.rag.index.InvertedIndex;
import eu.virtualparadox.docsift.rag.index.InvertedIndexBuilder;
import eu.virtualparadox.docsift.rag.match.MatchCandidate;
import eu.virtualparadox.docsift.rag.match.QueryTerms;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringTest {

    private final InvertedIndex index = new InvertedIndexBuilder(
            new TermExtractor(new TermAnalyzer(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET)))
            .build(List.of(
                    new Chunk("d", 0, "acme total", 0, 10),
                    new Chunk("d", 1, "acme", 11, 15),
                    new Chunk("d", 2, "acme rare", 16, 25),
                    new Chunk("d", 3, "other", 26, 31)));

    private final ScoringContext context =
            new ScoringContext(new QueryTerms("acme rare", List.of("acme", "rare")), index);

    private static MatchCandidate candidate(String text, Map<String, Integer> frequencies) {
        return new MatchCandidate("d", null, text, frequencies);
    }

    @Test
    @DisplayName("Distinct term scoring counts matched terms")
    void distinctTerms() {
        assertEquals(2.0, new DistinctTermScoring().score(candidate("x", Map.of("acme", 5, "rare", 1)), context));
    }

    @Test
    @DisplayName("Term frequency scoring sums occurrences")
    void termFrequency() {
        assertEquals(6.0, new TermFrequencyScoring().score(candidate("x", Map.of("acme", 5, "rare", 1)), context));
    }

    @Test
    @DisplayName("Inverse document frequency scoring favors rare terms")
    void inverseDocumentFrequency() {
        InverseDocumentFrequencyScoring scoring = new InverseDocumentFrequencyScoring();

        double common = scoring.score(candidate("x", Map.of("acme", 1)), context);
        double rare = scoring.score(candidate("x", Map.of("rare", 1)), context);

        assertEquals(1 + Math.log(4.0 / 3), common, 1e-9);
        assertEquals(1 + Math.log(4.0), rare, 1e-9);
        assertTrue(rare > common);
        // terms outside the index count as the rarest
        assertEquals(rare, scoring.score(candidate("x", Map.of("invoice_1", 1)), context), 1e-9);
    }

    @Test
    @DisplayName("Phrase boost applies only when the terms occur consecutively")
    void phraseBoost() {
        PhraseBoostScoring scoring = new PhraseBoostScoring(new DistinctTermScoring(), 0.5);
        Map<String, Integer> both = Map.of("acme", 1, "rare", 1);

        assertEquals(2.5, scoring.score(candidate("Acme rare items", both), context));
        assertEquals(2.0, scoring.score(candidate("rare Acme items", both), context));
        assertThrows(IllegalArgumentException.class, () -> new PhraseBoostScoring(new DistinctTermScoring(), -1));
    }

    @Test
    @DisplayName("Scoring modes map to their functions")
    void scoringModes() {
        assertInstanceOf(DistinctTermScoring.class, EScoringMode.DISTINCT_TERMS.function());
        assertInstanceOf(TermFrequencyScoring.class, EScoringMode.TERM_FREQUENCY.function());
        assertInstanceOf(InverseDocumentFrequencyScoring.class, EScoringMode.INVERSE_DOCUMENT_FREQUENCY.function());
    }
}
