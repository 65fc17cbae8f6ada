package eu.virtualparadox.docsift.query.job;

import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.rag.retriever.model.SearchResult;

import java.time.Instant;
import java.util.List;

public class RetrievalJob {
    private final long id;
    private final String query;
    private final ECategory category;
    private final int k;
    private volatile ERetrievalStatus status;
    private volatile List<SearchResult> results;
    private volatile String error;
    private final Instant createdAt;

    public RetrievalJob(long id, String query, ECategory category, int k) {
        this.id = id;
        this.query = query;
        this.category = category;
        this.k = k;
        this.status = ERetrievalStatus.QUEUED;
        this.results = List.of();
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public String getQuery() { return query; }
    public ECategory getCategory() { return category; }
    public int getK() { return k; }
    public ERetrievalStatus getStatus() { return status; }
    public List<SearchResult> getResults() { return results; }
    public String getError() { return error; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean isDone() {
        return status == ERetrievalStatus.COMPLETED || status == ERetrievalStatus.FAILED;
    }

    public void setStatus(ERetrievalStatus status) { this.status = status; }
    public void setResults(List<SearchResult> results) { this.results = List.copyOf(results); }
    public void setError(String error) { this.error = error; }
}
