package eu.virtualparadox.docsift.application.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import eu.virtualparadox.docsift.query.cache.CacheKey;
import eu.virtualparadox.docsift.query.cache.CachedResponse;
import eu.virtualparadox.docsift.query.job.RetrievalJob;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    public Cache<CacheKey, CachedResponse> responseCacheStore(final ApplicationConfig props) {
        return Caffeine.newBuilder()
                .maximumSize(Math.max(1L, props.getCache().getMaxEntries()))
                .build();
    }

    @Bean
    public Cache<Long, RetrievalJob> retrievalJobStore(final ApplicationConfig props) {
        return Caffeine.newBuilder()
                .maximumSize(Math.max(1L, props.getQuery().getMaxJobs()))
                .expireAfterWrite(props.getQuery().getJobRetention())
                .build();
    }
}
