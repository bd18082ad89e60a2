package io.gdcc.repository.collections.query;

/** A collection object found by a search, label may be {@code null}. */
public record CollectionCandidate(String pid, String label) {}
