package eu.virtualparadox.docsift.query.job;

public enum ERetrievalStatus {
    QUEUED,
    RETRIEVING,
    COMPLETED,
    FAILED
}
