package io.gdcc.repository.collections.repository;

import io.gdcc.repository.collections.rels.RelationshipStore;
import java.util.Objects;

/**
 * A repository object as seen by membership code: its PID and a handle on its relationships. The
 * hosting repository owns the object's lifecycle.
 */
public record RepositoryObject(Pid pid, RelationshipStore relationships) {
    public RepositoryObject {
        Objects.requireNonNull(pid, "pid");
        Objects.requireNonNull(relationships, "relationships");
    }

    public String id() {
        return pid.toString();
    }
}
