package io.gdcc.repository.collections.membership;

import static io.gdcc.repository.collections.rels.Vocabulary.IS_MEMBER_OF;
import static io.gdcc.repository.collections.rels.Vocabulary.IS_MEMBER_OF_COLLECTION;
import static io.gdcc.repository.collections.rels.Vocabulary.RELS_EXT_URI;

import io.gdcc.repository.collections.rels.RelationshipStore;
import io.gdcc.repository.collections.rels.RelationshipTriple;
import io.gdcc.repository.collections.repository.ObjectRepository;
import io.gdcc.repository.collections.repository.RepositoryObject;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds and removes collection membership relationships and reports the parents of an object.
 *
 * <p>Membership is an {@code isMemberOfCollection} triple from the member to the collection.
 * Objects migrated from older repositories may use {@code isMemberOf} instead; both are read as
 * parents and both are removed when membership ends.
 */
public class MembershipManager {
    private static final Logger LOG = LoggerFactory.getLogger(MembershipManager.class);

    private final ObjectRepository repository;

    public MembershipManager(ObjectRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    /** Adds the membership unless the member already has it. */
    public void addToCollection(RepositoryObject member, RepositoryObject collection) {
        RelationshipStore rels = member.relationships();
        if (!rels.get(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, collection.id()).isEmpty()) {
            LOG.debug("{} already a member of {}", member.id(), collection.id());
            return;
        }
        rels.add(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, collection.id());
        repository.touch(member);
        LOG.debug("Added {} to collection {}", member.id(), collection.id());
    }

    /**
     * @throws io.gdcc.repository.collections.error.NotFoundException if either object is missing
     */
    public void addToCollection(String memberPid, String collectionPid) {
        RepositoryObject collection = repository.get(collectionPid);
        addToCollection(repository.get(memberPid), collection);
    }

    /** Removes both membership predicates pointing at the collection. Absent links are fine. */
    public void removeFromCollection(RepositoryObject member, RepositoryObject collection) {
        RelationshipStore rels = member.relationships();
        boolean linked =
                !rels.get(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, collection.id()).isEmpty()
                        || !rels.get(RELS_EXT_URI, IS_MEMBER_OF, collection.id()).isEmpty();
        rels.remove(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, collection.id());
        rels.remove(RELS_EXT_URI, IS_MEMBER_OF, collection.id());
        if (linked) {
            repository.touch(member);
            LOG.debug("Removed {} from collection {}", member.id(), collection.id());
        }
    }

    /**
     * @throws io.gdcc.repository.collections.error.NotFoundException if either object is missing
     */
    public void removeFromCollection(String memberPid, String collectionPid) {
        RepositoryObject collection = repository.get(collectionPid);
        removeFromCollection(repository.get(memberPid), collection);
    }

    /** PIDs of every collection the object belongs to, in discovery order, without blanks. */
    public Set<String> getParentPids(RepositoryObject object) {
        Set<String> parents = new LinkedHashSet<>();
        collect(object.relationships(), IS_MEMBER_OF_COLLECTION, parents);
        collect(object.relationships(), IS_MEMBER_OF, parents);
        return parents;
    }

    /** Parents other than {@code excludedParent}; unchanged when it is not a parent. */
    public Set<String> getOtherParents(RepositoryObject object, RepositoryObject excludedParent) {
        Set<String> parents = getParentPids(object);
        parents.remove(excludedParent.id());
        return parents;
    }

    /** Adds every member to {@code target}; existing parents are kept. */
    public void shareMembers(RepositoryObject target, Collection<RepositoryObject> members) {
        for (RepositoryObject member : members) {
            addToCollection(member, target);
        }
        LOG.info("Shared {} object(s) with {}", members.size(), target.id());
    }

    /** Moves every member from {@code source} to {@code target}. */
    public void migrateMembers(
            RepositoryObject source,
            RepositoryObject target,
            Collection<RepositoryObject> members) {
        if (source.id().equals(target.id())) {
            return;
        }
        for (RepositoryObject member : members) {
            addToCollection(member, target);
            removeFromCollection(member, source);
        }
        LOG.info("Migrated {} object(s) from {} to {}", members.size(), source.id(), target.id());
    }

    private static void collect(
            RelationshipStore rels, String predicateName, Set<String> into) {
        for (RelationshipTriple triple : rels.get(RELS_EXT_URI, predicateName)) {
            String value = triple.objectValue();
            if (value != null && !value.isBlank()) {
                into.add(value);
            }
        }
    }
}
