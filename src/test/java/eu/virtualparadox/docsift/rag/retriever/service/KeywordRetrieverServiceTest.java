package eu.virtualparadox.docsift.rag.retriever.service;

import eu.virtualparadox.docsift.application.config.ApplicationConfig;
import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.ingest.model.ChunkRef;
import eu.virtualparadox.docsift.rag.index.CategoryIndex;
import eu.virtualparadox.docsift.rag.index.CorpusHandle;
import eu.virtualparadox.docsift.rag.index.IndexNotReadyException;
import eu.virtualparadox.docsift.rag.match.EMatchStrategy;
import eu.virtualparadox.docsift.rag.match.KeywordMatcher;
import eu.virtualparadox.docsift.rag.match.MatchCandidate;
import eu.virtualparadox.docsift.rag.match.QueryTerms;
import eu.virtualparadox.docsift.rag.rank.EResultGranularity;
import eu.virtualparadox.docsift.rag.rank.EScoringMode;
import eu.virtualparadox.docsift.rag.retriever.model.SearchResult;
import eu.virtualparadox.docsift.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeywordRetrieverServiceTest {

    private static final String INVOICE_1 = "Invoice INV-2025-001 total due $450 from Acme Corp";

    @TempDir
    Path root;

    private final EngineFixture engine = EngineFixture.create();

    private CorpusHandle loadInvoices() throws Exception {
        EngineFixture.write(root, ECategory.INVOICES, "invoice_1.txt", INVOICE_1);
        EngineFixture.write(root, ECategory.INVOICES, "invoice_2.txt", "Invoice INV-2025-002 total $120 from Globex");
        return engine.indexService.loadCorpus(root);
    }

    private static List<String> fileNames(List<SearchResult> results) {
        return results.stream().map(SearchResult::fileName).toList();
    }

    private static List<Double> scores(List<SearchResult> results) {
        return results.stream().map(SearchResult::score).toList();
    }

    @Test
    @DisplayName("The best matching invoice is returned with one point per matched term")
    void invoiceScenario() throws Exception {
        EngineFixture.write(root, ECategory.INVOICES, "invoice_1.txt", INVOICE_1);
        CorpusHandle handle = engine.indexService.loadCorpus(root);

        List<SearchResult> results = engine.retriever.retrieve(handle, "total due Acme", ECategory.INVOICES, 1);

        assertEquals(1, results.size());
        SearchResult result = results.get(0);
        assertEquals("invoice_1.txt", result.fileName());
        assertEquals("invoices/invoice_1.txt", result.docId());
        assertEquals("invoices/invoice_1.txt_00000", result.chunkId());
        assertEquals(INVOICE_1, result.text());
        assertEquals(0, result.start());
        assertEquals(INVOICE_1.length(), result.end());
        assertEquals(3.0, result.score());
    }

    @Test
    @DisplayName("Results are ranked best first and limited to k")
    void rankingAndLimit() throws Exception {
        CorpusHandle handle = loadInvoices();

        List<SearchResult> results = engine.retriever.retrieve(handle, "total due Acme", ECategory.INVOICES, 5);
        assertEquals(List.of("invoice_1.txt", "invoice_2.txt"), fileNames(results));
        assertEquals(List.of(3.0, 1.0), scores(results));

        assertEquals(List.of("invoice_1.txt"),
                fileNames(engine.retriever.retrieve(handle, "total", ECategory.INVOICES, 1)));
    }

    @Test
    @DisplayName("Queries without terms, without matches or with k = 0 return an empty list")
    void emptyResults() throws Exception {
        CorpusHandle handle = loadInvoices();

        assertTrue(engine.retriever.retrieve(handle, "", ECategory.INVOICES, 5).isEmpty());
        assertTrue(engine.retriever.retrieve(handle, "?!", ECategory.INVOICES, 5).isEmpty());
        assertTrue(engine.retriever.retrieve(handle, "the of", ECategory.INVOICES, 5).isEmpty());
        assertTrue(engine.retriever.retrieve(handle, "unicorn", ECategory.INVOICES, 5).isEmpty());
        assertTrue(engine.retriever.retrieve(handle, "acme", ECategory.INVOICES, 0).isEmpty());
        assertTrue(engine.retriever.retrieve(handle, "acme", ECategory.CONTRACTS, 5).isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> engine.retriever.retrieve(handle, "acme", ECategory.INVOICES, -1));
    }

    @Test
    @DisplayName("Retrieving against the current corpus fails until one is loaded")
    void notReadyBeforeLoad() throws Exception {
        assertThrows(IndexNotReadyException.class, () -> engine.retriever.retrieve("acme", ECategory.INVOICES, 5));

        loadInvoices();

        assertEquals(1, engine.retriever.retrieve("acme", ECategory.INVOICES, 5).size());
    }

    @Test
    @DisplayName("A document added on reload is found after the reload and not before")
    void reloadScenario() throws Exception {
        CorpusHandle before = loadInvoices();
        assertTrue(engine.retriever.retrieve("initech", ECategory.INVOICES, 5).isEmpty());

        EngineFixture.write(root, ECategory.INVOICES, "invoice_3.txt", "Invoice INV-2025-003 for Initech");
        engine.indexService.loadCorpus(root);

        assertEquals(List.of("invoice_3.txt"),
                fileNames(engine.retriever.retrieve("initech", ECategory.INVOICES, 5)));
        // a handle keeps answering from the version it was issued for
        assertTrue(engine.retriever.retrieve(before, "initech", ECategory.INVOICES, 5).isEmpty());
    }

    @Test
    @DisplayName("Repeated queries are served from the cache")
    void repeatedQueryIsCached() throws Exception {
        CorpusHandle handle = loadInvoices();

        List<SearchResult> first = engine.retriever.retrieve(handle, "Acme total", ECategory.INVOICES, 5);
        List<SearchResult> second = engine.retriever.retrieve(handle, "  ACME, total!! ", ECategory.INVOICES, 5);

        assertSame(first, second);
        assertEquals(1, engine.responseCache.size());
    }

    @Test
    @DisplayName("Concurrent identical queries run the matching path once")
    void concurrentQueriesComputeOnce() throws Exception {
        AtomicInteger matches = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        KeywordMatcher slowMatcher = new KeywordMatcher(engine.termExtractor) {
            @Override
            public Map<ChunkRef, MatchCandidate> match(CategoryIndex index, QueryTerms query,
                                                       EMatchStrategy strategy, boolean matchFileNames) {
                matches.incrementAndGet();
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.match(index, query, strategy, matchFileNames);
            }
        };
        KeywordRetrieverService retriever = new KeywordRetrieverService(
                engine.registry, slowMatcher, engine.ranker, engine.responseCache, engine.props);
        CorpusHandle handle = loadInvoices();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<List<SearchResult>> first = pool.submit(() -> retriever.retrieve(handle, "total due", ECategory.INVOICES, 5));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Future<List<SearchResult>> second = pool.submit(() -> retriever.retrieve(handle, "Total  DUE", ECategory.INVOICES, 5));
            Thread.sleep(100);
            release.countDown();

            List<SearchResult> firstResults = first.get(5, TimeUnit.SECONDS);
            assertEquals(firstResults, second.get(5, TimeUnit.SECONDS));
            assertEquals(1, matches.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Document granularity returns whole documents without chunk ids")
    void documentGranularity() throws Exception {
        ApplicationConfig props = new ApplicationConfig();
        props.getRetrieval().setGranularity(EResultGranularity.DOCUMENT);
        EngineFixture documents = new EngineFixture(props, 5, 1);
        String text = "Acme ordered widgets. Acme paid the total.\n\nAcme again here.";
        EngineFixture.write(root, ECategory.INVOICES, "invoice_9.txt", text);
        CorpusHandle handle = documents.indexService.loadCorpus(root);

        List<SearchResult> results = documents.retriever.retrieve(handle, "acme total", ECategory.INVOICES, 5);

        assertEquals(1, results.size());
        assertNull(results.get(0).chunkId());
        assertEquals(text, results.get(0).text());
        assertEquals(text.length(), results.get(0).end());
        assertEquals(2.0, results.get(0).score());
    }

    @Test
    @DisplayName("Term frequency scoring and phrase boost follow the configuration")
    void configuredScoring() throws Exception {
        ApplicationConfig props = new ApplicationConfig();
        props.getRetrieval().setScoring(EScoringMode.TERM_FREQUENCY);
        props.getRetrieval().setPhraseBoost(10);
        EngineFixture tuned = new EngineFixture(props, 500, 50);
        EngineFixture.write(root, ECategory.SUPPORT, "ticket_1.txt", "Printer jam. Printer jam again. Printer!");
        EngineFixture.write(root, ECategory.SUPPORT, "ticket_2.txt", "Paper jam in the printer");
        CorpusHandle handle = tuned.indexService.loadCorpus(root);

        List<SearchResult> results = tuned.retriever.retrieve(handle, "printer jam", ECategory.SUPPORT, 5);

        assertEquals(List.of("ticket_1.txt", "ticket_2.txt"), fileNames(results));
        assertEquals(List.of(15.0, 2.0), scores(results));
    }

    @Test
    @DisplayName("Naming a file in the query retrieves it")
    void fileNameMention() throws Exception {
        CorpusHandle handle = loadInvoices();

        assertEquals(List.of("invoice_2.txt"),
                fileNames(engine.retriever.retrieve(handle, "show me invoice_2", ECategory.INVOICES, 1)));
    }

    @Test
    @DisplayName("Queries with the same terms but different file mentions are cached apart")
    void fileMentionIsPartOfTheCacheKey() throws Exception {
        CorpusHandle handle = loadInvoices();

        List<SearchResult> mentioned = engine.retriever.retrieve(handle, "invoice_2 total", ECategory.INVOICES, 5);
        List<SearchResult> plain = engine.retriever.retrieve(handle, "invoice 2 total", ECategory.INVOICES, 5);

        assertEquals(List.of("invoice_2.txt", "invoice_1.txt"), fileNames(mentioned));
        assertEquals(List.of(3.0, 2.0), scores(mentioned));
        assertEquals(List.of("invoice_1.txt", "invoice_2.txt"), fileNames(plain));
        assertEquals(List.of(2.0, 2.0), scores(plain));
        assertEquals(2, engine.responseCache.size());

        EngineFixture fresh = EngineFixture.create();
        assertEquals(plain, fresh.retriever.retrieve(fresh.indexService.loadCorpus(root),
                "invoice 2 total", ECategory.INVOICES, 5));
    }

    @Test
    @DisplayName("Queries running during reloads see exactly one corpus version each")
    void queriesDuringReloadSeeOneVersion() throws Exception {
        Path first = root.resolve("first");
        Path second = root.resolve("second");
        for (int i = 1; i <= 5; i++) {
            EngineFixture.write(first, ECategory.INVOICES, "alpha_" + i + ".txt", "Shared ledger entry " + i);
            EngineFixture.write(second, ECategory.INVOICES, "beta_" + i + ".txt", "Shared ledger entry " + i);
        }
        engine.indexService.loadCorpus(first);

        String[] queries = {"shared", "ledger entry", "shared ledger"};
        List<String> mixed = new ArrayList<>();
        AtomicInteger completed = new AtomicInteger();
        CountDownLatch reloadsDone = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                final int offset = t;
                readers.add(pool.submit(() -> {
                    int i = offset;
                    while (reloadsDone.getCount() > 0 || i < offset + 50) {
                        List<SearchResult> results = engine.retriever.retrieve(
                                queries[i % queries.length], ECategory.INVOICES, 5 + i % 4);
                        List<String> prefixes = results.stream()
                                .map(result -> result.fileName().substring(0, result.fileName().indexOf('_')))
                                .distinct()
                                .toList();
                        if (results.size() != 5 || prefixes.size() != 1) {
                            synchronized (mixed) {
                                mixed.add(fileNames(results).toString());
                            }
                        }
                        completed.incrementAndGet();
                        i++;
                    }
                    return null;
                }));
            }

            for (int reload = 0; reload < 20; reload++) {
                engine.indexService.loadCorpus(reload % 2 == 0 ? second : first);
            }
            reloadsDone.countDown();

            for (Future<?> reader : readers) {
                reader.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(mixed.isEmpty(), () -> "results mixing versions: " + mixed);
        assertTrue(completed.get() >= 200, "completed " + completed.get());
        assertEquals(21, engine.indexService.currentHandle().version());
    }

    @Test
    @DisplayName("Answers are computed once per query and corpus version")
    void answerIsMemoized() throws Exception {
        CorpusHandle handle = loadInvoices();
        AtomicInteger calls = new AtomicInteger();

        for (int i = 0; i < 2; i++) {
            String answer = engine.retriever.answer(handle, "acme", ECategory.INVOICES, 3, results -> {
                calls.incrementAndGet();
                return results.get(0).fileName();
            });
            assertEquals("invoice_1.txt", answer);
        }
        assertEquals(1, calls.get());
    }
}
