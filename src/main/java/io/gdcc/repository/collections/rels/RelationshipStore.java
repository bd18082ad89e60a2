package io.gdcc.repository.collections.rels;

import java.util.List;

/**
 * Read/write access to the relationship triples of a single repository object. Multi-valued
 * relations are allowed; callers that need uniqueness check with {@link #get} first.
 */
public interface RelationshipStore {

    /** All triples with the given predicate. */
    default List<RelationshipTriple> get(String predicateUri, String predicateName) {
        return get(predicateUri, predicateName, null);
    }

    /**
     * Triples with the given predicate whose object equals {@code valueFilter}.
     *
     * @param valueFilter object value to match, or {@code null} to match any value
     */
    List<RelationshipTriple> get(String predicateUri, String predicateName, String valueFilter);

    /** Adds a relationship to another object identified by PID. */
    default void add(String predicateUri, String predicateName, String value) {
        add(predicateUri, predicateName, value, false);
    }

    void add(String predicateUri, String predicateName, String value, boolean literal);

    /**
     * Removes matching triples. Removing a triple that does not exist does nothing.
     *
     * @param value object value to remove, or {@code null} to remove every value of the predicate
     */
    void remove(String predicateUri, String predicateName, String value);
}
