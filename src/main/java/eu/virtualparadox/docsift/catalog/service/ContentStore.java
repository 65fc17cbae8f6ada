package eu.virtualparadox.docsift.catalog.service;

import eu.virtualparadox.docsift.application.config.ApplicationConfig;
import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.catalog.model.Document;
import eu.virtualparadox.docsift.rag.index.CorpusRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads corpus documents from disk and serves their cached content.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Scanning {@code <root>/<category-dir>} for files with an accepted extension</li>
 *     <li>Reading each file once as UTF-8; unreadable files are logged and skipped so that one
 *     bad file never blocks the rest of the corpus</li>
 *     <li>Serving loaded content by document id from the published snapshot, without disk access</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContentStore {

    private static final String ERROR_NOT_FOUND = "Document not found: ";

    private final ApplicationConfig props;
    private final CorpusRegistry registry;

    /**
     * Loads every accepted file of a category directory.
     *
     * @param corpusRoot corpus root directory
     * @param category   category whose directory is scanned (non-recursive)
     * @return loaded documents in file-name order; empty if the directory does not exist
     * @throws IOException if the directory exists but cannot be listed
     */
    public Set<Document> load(final Path corpusRoot, final ECategory category) throws IOException {
        final Path directory = corpusRoot.resolve(category.directoryName());
        if (!Files.isDirectory(directory)) {
            log.info("Category folder not found, category {} stays empty: {}", category, directory);
            return Set.of();
        }

        final List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(this::hasAcceptedExtension)
                    .sorted()
                    .toList();
        }

        final Set<Document> documents = new LinkedHashSet<>();
        for (Path file : files) {
            readDocument(category, file).ifPresent(documents::add);
        }

        log.info("Loaded {} of {} documents for category {}", documents.size(), files.size(), category);
        return Collections.unmodifiableSet(documents);
    }

    /**
     * Returns a loaded document without touching disk.
     *
     * @param documentId document identifier ({@code <category-dir>/<file-name>})
     * @return the document from the published snapshot
     * @throws IllegalArgumentException if no such document is loaded
     * @throws eu.virtualparadox.docsift.rag.index.IndexNotReadyException if no corpus is loaded yet
     */
    public Document get(final String documentId) {
        return registry.current()
                .document(documentId)
                .orElseThrow(() -> new IllegalArgumentException(ERROR_NOT_FOUND + documentId));
    }

    private Optional<Document> readDocument(final ECategory category, final Path file) {
        final String fileName = file.getFileName().toString();
        try {
            final String text = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(new Document(
                    Document.idOf(category, fileName),
                    category,
                    fileName,
                    text,
                    Instant.now()));
        } catch (IOException e) {
            log.warn("Skipping unreadable document {}", file, e);
            return Optional.empty();
        }
    }

    private boolean hasAcceptedExtension(final Path file) {
        final String name = file.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        final String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return props.getExtensions().stream()
                .anyMatch(accepted -> accepted.toLowerCase(Locale.ROOT).equals(extension));
    }
}
