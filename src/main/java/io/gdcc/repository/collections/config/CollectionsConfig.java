package io.gdcc.repository.collections.config;

import io.gdcc.repository.collections.error.InvalidArgumentException;
import io.gdcc.repository.collections.query.PageRequest;
import io.gdcc.repository.collections.rels.Vocabulary;
import java.time.Duration;
import java.util.Set;

/**
 * Settings for collection listing and search.
 *
 * @param namespaceRestricted when true only {@code allowedNamespaces} are searchable
 * @param allowedNamespaces namespaces accessible while restricted
 * @param defaultPageSize page size used when the caller gives none
 * @param maxPageSize largest accepted page size
 * @param collectionContentModel PID of the content model marking collection objects
 * @param queryTimeout timeout for remote query backends
 */
public record CollectionsConfig(
        boolean namespaceRestricted,
        Set<String> allowedNamespaces,
        int defaultPageSize,
        int maxPageSize,
        String collectionContentModel,
        Duration queryTimeout) {

    public static final int DEFAULT_PAGE_SIZE = 12;
    public static final int DEFAULT_MAX_PAGE_SIZE = 100;
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);

    public CollectionsConfig {
        allowedNamespaces = Set.copyOf(allowedNamespaces);
        if (defaultPageSize <= 0 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException(
                    "Invalid page sizes: default=" + defaultPageSize + ", max=" + maxPageSize);
        }
    }

    public static CollectionsConfig defaults() {
        return new CollectionsConfig(
                false,
                Set.of(),
                DEFAULT_PAGE_SIZE,
                DEFAULT_MAX_PAGE_SIZE,
                Vocabulary.COLLECTION_CONTENT_MODEL,
                DEFAULT_QUERY_TIMEOUT);
    }

    /**
     * @param limit requested page size, {@code null} for the default
     * @throws InvalidArgumentException for a negative page or a limit outside 1..maxPageSize
     */
    public PageRequest pageRequest(int page, Integer limit) {
        int size = limit == null ? defaultPageSize : limit;
        if (size > maxPageSize) {
            throw new InvalidArgumentException(
                    "limit must be <= " + maxPageSize + ", was " + size);
        }
        return new PageRequest(page, size);
    }
}
