package eu.virtualparadox.docsift.rag.index;

import eu.virtualparadox.docsift.ingest.chunker.Chunker;
import eu.virtualparadox.docsift.ingest.model.Chunk;
import eu.virtualparadox.docsift.ingest.model.ChunkRef;
import eu.virtualparadox.docsift.rag.analysis.TermAnalyzer;
import eu.virtualparadox.docsift.rag.analysis.TermExtractor;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InvertedIndexBuilderTest {

    private final TermExtractor extractor =
            new TermExtractor(new TermAnalyzer(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET));
    private final InvertedIndexBuilder builder = new InvertedIndexBuilder(extractor);
    private final Chunker chunker = new Chunker(8, 2);

    private List<Chunk> corpusChunks() {
        List<Chunk> chunks = new ArrayList<>();
        chunks.addAll(chunker.chunk("invoices/a.txt", "Invoice for Acme. Total due 100 EUR.\n\nPayment due in 30 days."));
        chunks.addAll(chunker.chunk("invoices/b.txt", "Globex invoice. Total 200 EUR. Acme is not involved in this one at all really."));
        chunks.addAll(chunker.chunk("invoices/c.txt", "The and of"));
        return chunks;
    }

    @Test
    @DisplayName("Postings carry the in-chunk frequency of each term")
    void postingsCarryFrequencies() {
        Chunk chunk = new Chunk("invoices/a.txt", 0, "Acme acme ACME due", 0, 18);
        InvertedIndex index = builder.build(List.of(chunk));

        assertEquals(List.of(new Posting("invoices/a.txt", 0, 3)), index.postings("acme"));
        assertEquals(List.of(new Posting("invoices/a.txt", 0, 1)), index.postings("due"));
        assertTrue(index.postings("missing").isEmpty());
        assertEquals(1, index.chunkCount());
    }

    @Test
    @DisplayName("Every indexed term has a non-empty posting list without duplicate chunks")
    void postingInvariantsHold() {
        List<Chunk> chunks = corpusChunks();
        InvertedIndex index = builder.build(chunks);

        Set<ChunkRef> refs = new HashSet<>();
        chunks.forEach(c -> refs.add(c.ref()));
        index.validate(refs);

        assertFalse(index.terms().isEmpty());
        for (String stopWord : List.of("the", "and", "of")) {
            assertFalse(index.terms().contains(stopWord), stopWord);
        }
        for (String term : index.terms()) {
            List<Posting> postings = index.postings(term);
            assertFalse(postings.isEmpty(), term);
            assertEquals(postings.size(), postings.stream().map(Posting::ref).distinct().count(), term);
            for (Posting posting : postings) {
                Chunk chunk = chunks.stream().filter(c -> c.ref().equals(posting.ref())).findFirst().orElseThrow();
                assertTrue(extractor.terms(chunk.text()).contains(term), term);
            }
        }
        assertEquals(chunks.size(), index.chunkCount());
    }

    @Test
    @DisplayName("Building is idempotent and independent of chunk order")
    void buildIsOrderIndependent() {
        List<Chunk> chunks = corpusChunks();
        InvertedIndex reference = builder.build(chunks);

        Random rnd = new Random(11);
        for (int i = 0; i < 10; i++) {
            List<Chunk> shuffled = new ArrayList<>(chunks);
            Collections.shuffle(shuffled, rnd);
            assertEquals(reference, builder.build(shuffled));
        }
        assertEquals(reference.hashCode(), builder.build(chunks).hashCode());
    }

    @Test
    @DisplayName("A chunk location may only be indexed once")
    void duplicateChunkIsRejected() {
        Chunk chunk = new Chunk("invoices/a.txt", 0, "acme", 0, 4);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> builder.build(List.of(chunk, chunk)));
        assertTrue(e.getMessage().contains("invoices/a.txt_00000"), e.getMessage());
    }

    @Test
    @DisplayName("Validation rejects postings for unknown chunks and empty posting lists")
    void validationDetectsCorruption() {
        InvertedIndex dangling = new InvertedIndex(Map.of("acme", List.of(new Posting("x", 0, 1))), 1);
        assertThrows(IllegalStateException.class, () -> dangling.validate(Set.of(new ChunkRef("y", 0))));

        InvertedIndex empty = new InvertedIndex(Map.of("acme", List.of()), 0);
        assertThrows(IllegalStateException.class, () -> empty.validate(Set.of()));

        InvertedIndex duplicate = new InvertedIndex(
                Map.of("acme", List.of(new Posting("x", 0, 1), new Posting("x", 0, 2))), 1);
        assertThrows(IllegalStateException.class, () -> duplicate.validate(Set.of(new ChunkRef("x", 0))));
    }
}
