package eu.virtualparadox.docsift.application.config;

import eu.virtualparadox.docsift.application.executor.QueryExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public QueryExecutor queryExecutor(final ApplicationConfig props) {
        final int poolSize = Math.max(1, props.getQuery().getPoolSize());
        QueryExecutor executor = new QueryExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Math.max(1, props.getQuery().getQueueCapacity()));
        executor.setThreadNamePrefix("query-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
