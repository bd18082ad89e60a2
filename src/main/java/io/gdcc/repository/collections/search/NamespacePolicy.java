package io.gdcc.repository.collections.search;

/** Decides whether objects of a PID's namespace may be offered to the current user. */
@FunctionalInterface
public interface NamespacePolicy {
    boolean isAccessible(String pid);
}
