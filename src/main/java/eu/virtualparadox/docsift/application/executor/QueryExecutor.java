package eu.virtualparadox.docsift.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pool for query workers, kept as its own type so it can be injected unambiguously.
 */
public class QueryExecutor extends ThreadPoolTaskExecutor {
}
