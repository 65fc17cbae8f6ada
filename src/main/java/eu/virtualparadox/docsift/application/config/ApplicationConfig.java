package eu.virtualparadox.docsift.application.config;

import eu.virtualparadox.docsift.rag.match.EMatchStrategy;
import eu.virtualparadox.docsift.rag.rank.EResultGranularity;
import eu.virtualparadox.docsift.rag.rank.EScoringMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "docsift")
@Getter @Setter
public class ApplicationConfig {

    /**
     * Corpus root; each category reads the sub-directory named after it.
     */
    private Path root;

    private boolean loadOnStartup = true;

    /**
     * File extensions (without the dot) picked up from a category directory.
     */
    private List<String> extensions = new ArrayList<>(List.of("txt"));

    private Retrieval retrieval = new Retrieval();
    private Cache cache = new Cache();
    private Query query = new Query();
    private Analysis analysis = new Analysis();

    @Getter @Setter
    public static class Retrieval {
        private int defaultK = 5;
        private EScoringMode scoring = EScoringMode.DISTINCT_TERMS;
        private EResultGranularity granularity = EResultGranularity.CHUNK;
        private boolean matchFileNames = true;
        private EMatchStrategy matchStrategy = EMatchStrategy.INDEX;
        /**
         * Added once to a candidate whose text contains the query terms as a consecutive phrase.
         * Zero disables the refinement.
         */
        private double phraseBoost = 0.0;
    }

    @Getter @Setter
    public static class Cache {
        private long maxEntries = 1000;
    }

    @Getter @Setter
    public static class Query {
        private int poolSize = 4;
        private int queueCapacity = 1000;
        /**
         * How long a submitted job stays pollable after its last update.
         */
        private Duration jobRetention = Duration.ofMinutes(30);
        private long maxJobs = 10_000;
    }

    @Getter @Setter
    public static class Analysis {
        private boolean stopWords = true;
    }
}
