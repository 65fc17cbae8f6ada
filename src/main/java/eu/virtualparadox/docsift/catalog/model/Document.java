package eu.virtualparadox.docsift.catalog.model;

import eu.virtualparadox.docsift.catalog.ECategory;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable document loaded from the corpus.
 *
 * @param id       stable identifier, {@code <category-dir>/<file-name>}
 * @param category category the document was loaded for
 * @param fileName file name inside the category directory
 * @param text     full text content
 * @param loadedAt time the content was read from disk
 */
public record Document(String id, ECategory category, String fileName, String text, Instant loadedAt) {

    public Document {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(loadedAt, "loadedAt must not be null");
    }

    public static String idOf(final ECategory category, final String fileName) {
        return category.directoryName() + "/" + fileName;
    }

    /**
     * File name without its extension, lower-cased.
     */
    public String stem() {
        final int dot = fileName.lastIndexOf('.');
        final String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return stem.toLowerCase(Locale.ROOT);
    }
}
