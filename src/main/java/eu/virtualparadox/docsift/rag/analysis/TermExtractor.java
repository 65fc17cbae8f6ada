package eu.virtualparadox.docsift.rag.analysis;

import lombok.RequiredArgsConstructor;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns chunk and query text into normalized terms using the shared {@link Analyzer}.
 * <p>Thread-safe: Lucene analyzers reuse per-thread token stream components.</p>
 */
@Component
@RequiredArgsConstructor
public class TermExtractor {

    public static final String FIELD_TEXT = "text";

    private final Analyzer analyzer;

    /**
     * Extracts all terms in order of appearance, duplicates included.
     *
     * @param text any text, {@code null} is treated as empty
     * @return list of terms (never {@code null})
     */
    public List<String> terms(final String text) {
        final List<String> terms = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return terms;
        }

        try (TokenStream stream = analyzer.tokenStream(FIELD_TEXT, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                terms.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            // analysis reads from an in-memory reader
            throw new UncheckedIOException("Term analysis failed", e);
        }
        return terms;
    }

    /**
     * Distinct terms in first-occurrence order.
     */
    public Set<String> distinctTerms(final String text) {
        return new LinkedHashSet<>(terms(text));
    }

    /**
     * Term frequencies in first-occurrence order.
     */
    public Map<String, Integer> termFrequencies(final String text) {
        final Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String term : terms(text)) {
            frequencies.merge(term, 1, Integer::sum);
        }
        return frequencies;
    }
}
