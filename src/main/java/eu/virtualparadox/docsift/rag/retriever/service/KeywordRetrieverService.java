package eu.virtualparadox.docsift.rag.retriever.service;

import eu.virtualparadox.docsift.application.config.ApplicationConfig;
import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.catalog.model.Document;
import eu.virtualparadox.docsift.ingest.model.Chunk;
import eu.virtualparadox.docsift.ingest.model.ChunkRef;
import eu.virtualparadox.docsift.query.cache.CacheKey;
import eu.virtualparadox.docsift.query.cache.ResponseCache;
import eu.virtualparadox.docsift.rag.index.CategoryIndex;
import eu.virtualparadox.docsift.rag.index.CorpusHandle;
import eu.virtualparadox.docsift.rag.index.CorpusRegistry;
import eu.virtualparadox.docsift.rag.match.KeywordMatcher;
import eu.virtualparadox.docsift.rag.match.MatchCandidate;
import eu.virtualparadox.docsift.rag.match.QueryTerms;
import eu.virtualparadox.docsift.rag.rank.EResultGranularity;
import eu.virtualparadox.docsift.rag.rank.PhraseBoostScoring;
import eu.virtualparadox.docsift.rag.rank.Ranker;
import eu.virtualparadox.docsift.rag.rank.ScoredCandidate;
import eu.virtualparadox.docsift.rag.rank.ScoringContext;
import eu.virtualparadox.docsift.rag.rank.ScoringFunction;
import eu.virtualparadox.docsift.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Keyword retriever over the in-memory corpus index.
 * <p>
 * Steps:
 * <ol>
 *   <li>Normalize the query into its distinct analyzed terms</li>
 *   <li>Look up the response cache under (terms, mentioned file stems, category, k, granularity, corpus version)</li>
 *   <li>On a miss: match chunks with {@link KeywordMatcher}, optionally merge them per document</li>
 *   <li>Score with the configured {@link ScoringFunction} and keep the top-k with {@link Ranker}</li>
 *   <li>Return {@link SearchResult} DTOs, best first</li>
 * </ol>
 * A query without terms, or {@code k == 0}, returns an empty list without consulting the cache.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KeywordRetrieverService implements RetrieverService {

    private final CorpusRegistry registry;
    private final KeywordMatcher matcher;
    private final Ranker ranker;
    private final ResponseCache responseCache;
    private final ApplicationConfig props;

    /**
     * Executes a keyword search against one corpus version.
     *
     * @param corpus   corpus version to search
     * @param query    user query string
     * @param category category to search
     * @param k        maximum number of results
     * @return top-k results (never null)
     * @throws IllegalArgumentException if {@code k < 0}
     */
    @Override
    public List<SearchResult> retrieve(final CorpusHandle corpus,
                                       final String query,
                                       final ECategory category,
                                       final int k) {
        validate(corpus, category, k);
        final QueryTerms parsed = matcher.parse(query);
        if (parsed.isEmpty() || k == 0) {
            log.debug("Nothing to retrieve for query '{}' (k={})", query, k);
            return List.of();
        }
        return responseCache.getOrCompute(keyOf(corpus, parsed, category, k),
                () -> search(corpus, parsed, category, k));
    }

    @Override
    public List<SearchResult> retrieve(final String query, final ECategory category, final int k) {
        return retrieve(new CorpusHandle(registry.current()), query, category, k);
    }

    @Override
    public String answer(final CorpusHandle corpus,
                         final String query,
                         final ECategory category,
                         final int k,
                         final Function<List<SearchResult>, String> answerer) {
        validate(corpus, category, k);
        final QueryTerms parsed = matcher.parse(query);
        if (parsed.isEmpty() || k == 0) {
            return answerer.apply(List.of());
        }
        return responseCache.getOrComputeAnswer(keyOf(corpus, parsed, category, k),
                () -> search(corpus, parsed, category, k),
                answerer);
    }

    private List<SearchResult> search(final CorpusHandle corpus,
                                      final QueryTerms query,
                                      final ECategory category,
                                      final int k) {
        final long started = System.nanoTime();
        final ApplicationConfig.Retrieval settings = props.getRetrieval();
        final CategoryIndex index = corpus.snapshot().category(category);

        final Map<ChunkRef, MatchCandidate> matches =
                matcher.match(index, query, settings.getMatchStrategy(), settings.isMatchFileNames());
        final Collection<MatchCandidate> candidates = settings.getGranularity() == EResultGranularity.DOCUMENT
                ? matcher.byDocument(matches, index)
                : matches.values();

        final List<ScoredCandidate> top =
                ranker.rank(candidates, k, scoring(settings), new ScoringContext(query, index.index()));
        final List<SearchResult> results = top.stream()
                .map(scored -> toSearchResult(index, scored))
                .toList();

        log.debug("Query '{}' in {} (version {}): {} candidates, {} results in {} ms",
                query.normalized(), category, corpus.version(), candidates.size(), results.size(),
                (System.nanoTime() - started) / 1_000_000);
        return results;
    }

    private ScoringFunction scoring(final ApplicationConfig.Retrieval settings) {
        final ScoringFunction base = settings.getScoring().function();
        return settings.getPhraseBoost() > 0 ? new PhraseBoostScoring(base, settings.getPhraseBoost()) : base;
    }

    private SearchResult toSearchResult(final CategoryIndex index, final ScoredCandidate scored) {
        final MatchCandidate candidate = scored.candidate();
        final Document document = index.document(candidate.docId())
                .orElseThrow(() -> new IllegalStateException("Ranked unknown document: " + candidate.docId()));

        final Chunk chunk = candidate.chunk();
        if (chunk == null) {
            return new SearchResult(document.id(), document.fileName(), null,
                    document.text(), 0, document.text().length(), scored.score());
        }
        return new SearchResult(document.id(), document.fileName(), chunk.chunkId(),
                chunk.text(), chunk.start(), chunk.end(), scored.score());
    }

    /**
     * File-name mentions are read from the raw query, so queries with equal terms can still
     * select different documents; the mentioned stems are part of the key.
     */
    private CacheKey keyOf(final CorpusHandle corpus, final QueryTerms query, final ECategory category, final int k) {
        final ApplicationConfig.Retrieval settings = props.getRetrieval();
        final List<String> mentions = settings.isMatchFileNames()
                ? new ArrayList<>(new TreeSet<>(corpus.snapshot().category(category).documentsMentionedIn(query.raw()).keySet()))
                : List.of();
        return new CacheKey(query.normalized(), mentions, category, k, settings.getGranularity(), corpus.version());
    }

    private static void validate(final CorpusHandle corpus, final ECategory category, final int k) {
        Objects.requireNonNull(corpus, "corpus must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
    }
}
