package eu.virtualparadox.docsift.query.cache;

import com.github.benmanes.caffeine.cache.Cache;
import eu.virtualparadox.docsift.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Memoizes retrieval responses per {@link CacheKey}.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>At most one entry per key.</li>
 *   <li>Concurrent misses on the same key join one computation: Caffeine runs the loader
 *       atomically per key and the other callers wait for its value.</li>
 *   <li>A computation that throws stores nothing; the exception reaches the caller that ran it
 *       and the next request computes again.</li>
 *   <li>Answers are memoized the same way: one answerer call per key at a time, joined by
 *       concurrent callers through a per-key future. The answerer runs outside any cache lock.</li>
 *   <li>{@link #invalidateAll()} runs on every corpus publish. Keys carry the corpus version, so
 *       a response finished after a reload is stored under its old version and never served for
 *       the new one.</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResponseCache {

    private final Cache<CacheKey, CachedResponse> responseCacheStore;
    private final ConcurrentMap<CacheKey, PendingAnswer> pendingAnswers = new ConcurrentHashMap<>();

    private record PendingAnswer(Thread owner, CompletableFuture<String> answer) {
    }

    /**
     * Returns the cached results for {@code key}, computing them on a miss.
     *
     * @param key     response identity
     * @param compute produces the results on a miss; invoked at most once per miss
     * @return cached or freshly computed results
     */
    public List<SearchResult> getOrCompute(final CacheKey key, final Supplier<List<SearchResult>> compute) {
        return load(key, compute).results();
    }

    /**
     * Returns the cached answer for {@code key}, computing the results and then the answer as needed.
     *
     * @param key      response identity
     * @param retrieve produces the results if none are cached
     * @param answerer turns the results into answer text; invoked at most once per key
     * @return the answer text
     */
    public String getOrComputeAnswer(final CacheKey key,
                                     final Supplier<List<SearchResult>> retrieve,
                                     final Function<List<SearchResult>, String> answerer) {
        final CachedResponse loaded = load(key, retrieve);
        if (loaded.hasAnswer()) {
            return loaded.answer();
        }

        final PendingAnswer mine = new PendingAnswer(Thread.currentThread(), new CompletableFuture<>());
        final PendingAnswer running = pendingAnswers.putIfAbsent(key, mine);
        if (running != null) {
            if (running.owner() == Thread.currentThread()) {
                throw new IllegalStateException("Recursive answer computation for " + key);
            }
            return await(running.answer());
        }

        try {
            final String answer = answer(key, loaded, answerer);
            mine.answer().complete(answer);
            return answer;
        } catch (RuntimeException e) {
            mine.answer().completeExceptionally(e);
            throw e;
        } finally {
            pendingAnswers.remove(key, mine);
        }
    }

    public Optional<CachedResponse> find(final CacheKey key) {
        return Optional.ofNullable(responseCacheStore.getIfPresent(key));
    }

    public void invalidateAll() {
        responseCacheStore.invalidateAll();
        log.debug("Response cache cleared");
    }

    public long size() {
        responseCacheStore.cleanUp();
        return responseCacheStore.estimatedSize();
    }

    /**
     * Runs the answerer outside any cache lock and stores its answer on the entry, if the entry
     * is still cached. A caller that lost the race to a finished computation reuses its answer.
     */
    private String answer(final CacheKey key,
                          final CachedResponse loaded,
                          final Function<List<SearchResult>, String> answerer) {
        final CachedResponse current = responseCacheStore.getIfPresent(key);
        if (current != null && current.hasAnswer()) {
            return current.answer();
        }

        final String answer = Objects.requireNonNull(answerer.apply(loaded.results()), "answer must not be null");
        responseCacheStore.asMap().computeIfPresent(key, (k, existing) ->
                existing.hasAnswer() ? existing : existing.withAnswer(answer));
        log.debug("Answer memoized for {}", key);
        return answer;
    }

    private static String await(final CompletableFuture<String> answer) {
        try {
            return answer.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private CachedResponse load(final CacheKey key, final Supplier<List<SearchResult>> compute) {
        return responseCacheStore.get(key, k -> {
            log.debug("Response cache miss for {}", k);
            return CachedResponse.of(compute.get());
        });
    }
}
