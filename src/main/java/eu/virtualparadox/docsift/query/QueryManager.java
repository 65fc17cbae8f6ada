package eu.virtualparadox.docsift.query;

import eu.virtualparadox.docsift.application.config.ApplicationConfig;
import eu.virtualparadox.docsift.application.executor.QueryExecutor;
import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.query.job.RetrievalJob;
import eu.virtualparadox.docsift.query.job.RetrievalJobRegistry;
import eu.virtualparadox.docsift.rag.retriever.model.SearchResult;
import eu.virtualparadox.docsift.rag.retriever.service.RetrieverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static eu.virtualparadox.docsift.query.job.ERetrievalStatus.RETRIEVING;

/**
 * Runs queries on the {@link QueryExecutor} pool so that no query waits for another one.
 * Each query reads the corpus snapshot published when it starts.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryManager {

    private final RetrieverService retrieverService;
    private final RetrievalJobRegistry registry;
    private final QueryExecutor queryExecutor;
    private final ApplicationConfig props;

    /**
     * Queues a query for the configured default number of results ({@code docsift.retrieval.default-k}).
     */
    public RetrievalJob submitQuery(final String query, final ECategory category) {
        return submitQuery(query, category, props.getRetrieval().getDefaultK());
    }

    /**
     * Queues a query and returns its job right away; poll {@link #getJob(long)} for the outcome.
     */
    public RetrievalJob submitQuery(final String query, final ECategory category, final int k) {
        final RetrievalJob job = registry.createJob(query, category, k);
        queryExecutor.execute(() -> process(job));
        return job;
    }

    /**
     * Runs a query on the pool.
     *
     * @return future completed with the results, or exceptionally with the retrieval failure
     */
    public CompletableFuture<List<SearchResult>> retrieveAsync(final String query, final ECategory category, final int k) {
        return CompletableFuture.supplyAsync(() -> retrieverService.retrieve(query, category, k), queryExecutor);
    }

    private void process(final RetrievalJob job) {
        try {
            registry.updateStatus(job.getId(), RETRIEVING);
            final List<SearchResult> results = retrieverService.retrieve(job.getQuery(), job.getCategory(), job.getK());
            printDebugRetrieved(job, results);
            registry.complete(job.getId(), results);
        } catch (RuntimeException ex) {
            log.error("Job {} failed", job.getId(), ex);
            registry.fail(job.getId(), ex.getMessage());
        }
    }

    private void printDebugRetrieved(final RetrievalJob job, final List<SearchResult> results) {
        final StringBuilder sb = new StringBuilder();
        for (final SearchResult r : results) {
            sb.append(" - ").append("[").append(r.score()).append("] ").append(r.docId());
            if (r.chunkId() != null) {
                sb.append(" ").append(r.chunkId());
            }
            sb.append("\n");
        }
        log.debug("Job {} retrieved {} results:\n{}", job.getId(), results.size(), sb);
    }

    public Optional<RetrievalJob> getJob(final long jobId) {
        return registry.getJob(jobId);
    }
}
