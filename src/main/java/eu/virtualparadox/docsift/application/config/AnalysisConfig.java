package eu.virtualparadox.docsift.application.config;

import eu.virtualparadox.docsift.rag.analysis.TermAnalyzer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates and manages the Lucene analysis resources shared by indexing and query parsing.
 * <p>The same {@link Analyzer} instance must tokenize chunk text and query text, otherwise
 * query terms would not line up with indexed terms.</p>
 */
@Configuration
@Slf4j
public class AnalysisConfig {

    private Analyzer analyzer;

    /**
     * Provides the term analyzer: alphanumeric runs, lower-cased, English stop words removed
     * unless {@code docsift.analysis.stop-words=false}.
     *
     * @param props application properties
     * @return {@link TermAnalyzer} instance
     */
    @Bean
    public Analyzer analyzer(final ApplicationConfig props) {
        final CharArraySet stopWords = props.getAnalysis().isStopWords()
                ? EnglishAnalyzer.ENGLISH_STOP_WORDS_SET
                : CharArraySet.EMPTY_SET;
        this.analyzer = new TermAnalyzer(stopWords);
        return this.analyzer;
    }

    /**
     * Ensures the analyzer is closed cleanly on shutdown.
     */
    @PreDestroy
    public void close() {
        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }
    }
}
