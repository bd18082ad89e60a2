package io.gdcc.repository.collections.query;

import java.util.List;

/**
 * Query service answering membership listings and collection searches. Implementations may talk
 * to a local graph or a remote triple store.
 *
 * <p>Failures of the underlying service surface as {@link
 * io.gdcc.repository.collections.error.BackendUnavailableException}; bad arguments as {@link
 * io.gdcc.repository.collections.error.InvalidArgumentException} before anything is queried.
 */
public interface QueryBackend {

    /**
     * Lists one page of the members of a collection. The total count is computed independently of
     * the page slice.
     *
     * @param page zero-based page number
     * @param limit page size, greater than zero
     */
    PageResult queryMembers(String collectionPid, int page, int limit, FilterMode filterMode);

    /**
     * Objects having the given content model whose label or PID contains {@code textFilter},
     * ignoring case. A blank filter matches every such object.
     */
    List<CollectionCandidate> findCollections(String contentModel, String textFilter);
}
