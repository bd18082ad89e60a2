package io.gdcc.repository.collections.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gdcc.repository.collections.config.CollectionsConfig;
import io.gdcc.repository.collections.error.CollectionException;
import io.gdcc.repository.collections.query.CollectionCandidate;
import io.gdcc.repository.collections.query.QueryBackend;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds collection objects by label or PID for pickers such as "add to collection" autocomplete.
 */
public class CollectionSearch {
    private static final Logger LOG = LoggerFactory.getLogger(CollectionSearch.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final QueryBackend backend;
    private final NamespacePolicy namespacePolicy;
    private final CollectionsConfig config;

    public CollectionSearch(
            QueryBackend backend, NamespacePolicy namespacePolicy, CollectionsConfig config) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.namespacePolicy = Objects.requireNonNull(namespacePolicy, "namespacePolicy");
        this.config = Objects.requireNonNull(config, "config");
    }

    public CollectionSearch(QueryBackend backend, CollectionsConfig config) {
        this(backend, new ConfiguredNamespacePolicy(config), config);
    }

    /**
     * Collections whose label or PID contains {@code textFilter}, ignoring case, limited to
     * accessible namespaces.
     *
     * @return PID to {@code "label (pid)"}, ordered by label
     */
    public Map<String, String> searchCollections(String textFilter) {
        Map<String, String> result = new LinkedHashMap<>();
        for (CollectionCandidate candidate :
                backend.findCollections(config.collectionContentModel(), textFilter)) {
            if (!namespacePolicy.isAccessible(candidate.pid())) {
                continue;
            }
            result.putIfAbsent(candidate.pid(), displayLabel(candidate));
        }
        LOG.debug("Collection search '{}' matched {} collection(s)", textFilter, result.size());
        return result;
    }

    /** Serializes a search result as a flat JSON object. */
    public static String toJson(Map<String, String> result) {
        try {
            return MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new CollectionException("Could not serialize collection search result", e);
        }
    }

    private static String displayLabel(CollectionCandidate candidate) {
        String label = candidate.label();
        if (label == null || label.isBlank()) {
            return "(" + candidate.pid() + ")";
        }
        return label + " (" + candidate.pid() + ")";
    }
}
