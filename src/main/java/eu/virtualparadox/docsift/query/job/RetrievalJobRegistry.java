package eu.virtualparadox.docsift.query.job;

import com.github.benmanes.caffeine.cache.Cache;
import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.rag.retriever.model.SearchResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pollable retrieval jobs. Jobs live in a bounded store and expire a fixed time after their
 * last update, so finished results do not accumulate.
 */
@Service
public class RetrievalJobRegistry {

    private final AtomicLong counter;
    private final Cache<Long, RetrievalJob> jobs;

    public RetrievalJobRegistry(Cache<Long, RetrievalJob> retrievalJobStore) {
        this.counter = new AtomicLong(0);
        this.jobs = retrievalJobStore;
    }

    public RetrievalJob createJob(String query, ECategory category, int k) {
        long id = counter.incrementAndGet();
        RetrievalJob job = new RetrievalJob(id, query, category, k);
        jobs.put(id, job);
        return job;
    }

    public Optional<RetrievalJob> getJob(long id) {
        return Optional.ofNullable(jobs.getIfPresent(id));
    }

    public void updateStatus(long id, ERetrievalStatus status) {
        jobs.asMap().computeIfPresent(id, (key, job) -> {
            job.setStatus(status);
            return job;
        });
    }

    public void complete(long id, List<SearchResult> results) {
        jobs.asMap().computeIfPresent(id, (key, job) -> {
            job.setResults(results);
            job.setStatus(ERetrievalStatus.COMPLETED);
            return job;
        });
    }

    public void fail(long id, String error) {
        jobs.asMap().computeIfPresent(id, (key, job) -> {
            job.setError(error);
            job.setStatus(ERetrievalStatus.FAILED);
            return job;
        });
    }

    public long size() {
        jobs.cleanUp();
        return jobs.estimatedSize();
    }
}
