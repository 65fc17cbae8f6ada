package eu.virtualparadox.docsift.catalog;

import java.util.Locale;
import java.util.Set;

/**
 * Closed set of corpus categories. Each category owns one directory under the corpus root
 * and accepts a couple of aliases for the directory name.
 */
public enum ECategory {

    INVOICES("invoices", Set.of("invoices", "invoice")),
    CONTRACTS("employment-contracts", Set.of("contracts", "employment-contracts")),
    SUPPORT("customer-support", Set.of("support", "customer-support")),
    KNOWLEDGE("knowledge-base", Set.of("knowledge", "knowledge-base"));

    private final String directoryName;
    private final Set<String> aliases;

    ECategory(final String directoryName, final Set<String> aliases) {
        this.directoryName = directoryName;
        this.aliases = aliases;
    }

    public String directoryName() {
        return directoryName;
    }

    /**
     * Resolves a category from user input.
     *
     * @param value category name or alias, case-insensitive; {@code null} or blank selects {@link #INVOICES}
     * @return the matching category
     * @throws IllegalArgumentException if {@code value} names no known category
     */
    public static ECategory parse(final String value) {
        if (value == null || value.isBlank()) {
            return INVOICES;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ECategory category : values()) {
            if (category.aliases.contains(normalized) || category.name().equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }
}
