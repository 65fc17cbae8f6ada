package eu.virtualparadox.docsift.rag.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.pattern.PatternTokenizer;

import java.util.regex.Pattern;

/**
 * Lucene analyzer producing retrieval terms.
 * <ul>
 *   <li>tokens are maximal runs of letters and digits, so punctuation never reaches a term
 *       ({@code "INV-2025-001"} yields {@code inv}, {@code 2025}, {@code 001})</li>
 *   <li>tokens are lower-cased</li>
 *   <li>tokens found in the configured stop word set are dropped</li>
 * </ul>
 */
public final class TermAnalyzer extends Analyzer {

    private static final Pattern TERM = Pattern.compile(TermCharacters.REGEX_CLASS + "+");

    private final CharArraySet stopWords;

    public TermAnalyzer(final CharArraySet stopWords) {
        this.stopWords = stopWords;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer source = new PatternTokenizer(TERM, 0);
        TokenStream result = new LowerCaseFilter(source);
        result = new StopFilter(result, stopWords);
        return new TokenStreamComponents(source, result);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new LowerCaseFilter(in);
    }
}
