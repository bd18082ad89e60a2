package io.gdcc.repository.collections.repository;

import io.gdcc.repository.collections.error.NotFoundException;
import java.util.Optional;

/** Looks up repository objects by PID. */
public interface ObjectRepository {

    Optional<RepositoryObject> find(Pid pid);

    default Optional<RepositoryObject> find(String pid) {
        return find(Pid.parse(pid));
    }

    /**
     * @throws NotFoundException when no object carries the PID
     * @throws io.gdcc.repository.collections.error.InvalidArgumentException for a malformed PID
     */
    default RepositoryObject get(String pid) {
        return find(pid).orElseThrow(() -> new NotFoundException(pid));
    }

    default boolean exists(String pid) {
        return find(pid).isPresent();
    }

    /**
     * Records that the object's relationships changed. Repositories without timestamps ignore it.
     */
    default void touch(RepositoryObject object) {}
}
