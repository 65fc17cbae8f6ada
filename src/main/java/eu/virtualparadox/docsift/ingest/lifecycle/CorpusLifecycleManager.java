package eu.virtualparadox.docsift.ingest.lifecycle;

import eu.virtualparadox.docsift.application.config.ApplicationConfig;
import eu.virtualparadox.docsift.rag.index.CorpusHandle;
import eu.virtualparadox.docsift.rag.index.CorpusIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Ties corpus loading to the application lifecycle:
 * <ul>
 *   <li>Loads the configured {@code docsift.root} once the application is ready, if enabled</li>
 *   <li>Reloads the same root on demand</li>
 * </ul>
 * A failed startup load is logged and leaves the engine not ready; queries fail with
 * {@link eu.virtualparadox.docsift.rag.index.IndexNotReadyException} until a load succeeds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CorpusLifecycleManager {

    private final ApplicationConfig props;
    private final CorpusIndexService corpusIndexService;

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!props.isLoadOnStartup()) {
            log.info("Corpus load on startup disabled");
            return;
        }
        if (props.getRoot() == null) {
            log.warn("No corpus root configured (docsift.root); skipping startup load");
            return;
        }
        try {
            corpusIndexService.loadCorpus(props.getRoot());
        } catch (IOException | RuntimeException e) {
            log.error("Startup corpus load from {} failed", props.getRoot(), e);
        }
    }

    /**
     * Re-reads the configured root and publishes the result.
     *
     * @return handle to the new corpus version
     * @throws IOException if the root cannot be read; the previous version stays published
     */
    public CorpusHandle reload() throws IOException {
        final Path root = props.getRoot();
        if (root == null) {
            throw new IllegalStateException("No corpus root configured (docsift.root)");
        }
        try {
            return corpusIndexService.loadCorpus(root);
        } catch (IOException e) {
            log.error("Corpus reload from {} failed, keeping the published version", root, e);
            throw e;
        }
    }
}
