package io.gdcc.repository.collections.membership;

import static io.gdcc.repository.collections.rels.Vocabulary.IS_MEMBER_OF;
import static io.gdcc.repository.collections.rels.Vocabulary.IS_MEMBER_OF_COLLECTION;
import static io.gdcc.repository.collections.rels.Vocabulary.RELS_EXT_URI;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.gdcc.repository.collections.error.NotFoundException;
import io.gdcc.repository.collections.rels.RelationshipStore;
import io.gdcc.repository.collections.rels.RelationshipTriple;
import io.gdcc.repository.collections.rels.Vocabulary;
import io.gdcc.repository.collections.repository.JenaObjectRepository;
import io.gdcc.repository.collections.repository.ObjectRepository;
import io.gdcc.repository.collections.repository.Pid;
import io.gdcc.repository.collections.repository.RepositoryObject;
import java.util.List;
import org.apache.jena.rdf.model.ModelFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MembershipManagerTest {

    private JenaObjectRepository repository;
    private MembershipManager manager;
    private RepositoryObject member;
    private RepositoryObject collection;
    private RepositoryObject otherCollection;

    @BeforeEach
    void setUp() {
        repository = new JenaObjectRepository(ModelFactory.createDefaultModel());
        manager = new MembershipManager(repository);
        collection =
                repository.ingest(
                        "test:coll", "Coll", "admin", null, Vocabulary.COLLECTION_CONTENT_MODEL);
        otherCollection =
                repository.ingest(
                        "test:other", "Other", "admin", null, Vocabulary.COLLECTION_CONTENT_MODEL);
        member = repository.ingest("test:member", "Member", "admin", null);
    }

    @Test
    @DisplayName("addToCollection() twice leaves exactly one isMemberOfCollection triple")
    void add_is_idempotent() {
        manager.addToCollection(member, collection);
        manager.addToCollection(member, collection);

        assertThat(member.relationships().get(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, "test:coll"))
                .hasSize(1);
        assertThat(manager.getParentPids(member)).containsExactly("test:coll");
    }

    @Test
    @DisplayName("addToCollection() does not write when the relation already exists")
    void add_skips_write_when_present() {
        RelationshipStore rels = mock(RelationshipStore.class);
        when(rels.get(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, "test:coll"))
                .thenReturn(List.of(new RelationshipTriple(
                        "test:m", RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, "test:coll")));
        ObjectRepository repo = mock(ObjectRepository.class);
        RepositoryObject mocked = new RepositoryObject(Pid.parse("test:m"), rels);

        new MembershipManager(repo).addToCollection(mocked, collection);

        verify(rels, never()).add(anyString(), anyString(), anyString());
        verify(repo, never()).touch(any());
    }

    @Test
    @DisplayName("removeFromCollection() without a relation is a silent no-op")
    void remove_absent_is_noop() {
        manager.addToCollection(member, otherCollection);

        assertThatCode(() -> manager.removeFromCollection(member, collection))
                .doesNotThrowAnyException();
        assertThat(manager.getParentPids(member)).containsExactly("test:other");
    }

    @Test
    @DisplayName("removeFromCollection() cleans up isMemberOfCollection, isMemberOf or both")
    void remove_cleans_both_predicates() {
        RepositoryObject viaNew = repository.ingest("test:new", "n", "admin", null);
        RepositoryObject viaLegacy = repository.ingest("test:legacy", "l", "admin", null);
        RepositoryObject viaBoth = repository.ingest("test:both", "b", "admin", null);
        viaNew.relationships().add(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, "test:coll");
        viaLegacy.relationships().add(RELS_EXT_URI, IS_MEMBER_OF, "test:coll");
        viaBoth.relationships().add(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION, "test:coll");
        viaBoth.relationships().add(RELS_EXT_URI, IS_MEMBER_OF, "test:coll");
        viaBoth.relationships().add(RELS_EXT_URI, IS_MEMBER_OF, "test:other");

        for (RepositoryObject object : List.of(viaNew, viaLegacy, viaBoth)) {
            manager.removeFromCollection(object, collection);
            assertThat(manager.getParentPids(object)).doesNotContain("test:coll");
        }
        assertThat(manager.getParentPids(viaBoth)).containsExactly("test:other");
    }

    @Test
    @DisplayName("getParentPids() is the deduplicated union of both predicates without blanks")
    void parent_pids_union_without_duplicates_or_blanks() {
        RelationshipStore rels = mock(RelationshipStore.class);
        when(rels.get(RELS_EXT_URI, IS_MEMBER_OF_COLLECTION))
                .thenReturn(
                        List.of(
                                triple(IS_MEMBER_OF_COLLECTION, "test:a"),
                                triple(IS_MEMBER_OF_COLLECTION, "test:a"),
                                triple(IS_MEMBER_OF_COLLECTION, "  "),
                                triple(IS_MEMBER_OF_COLLECTION, null)));
        when(rels.get(RELS_EXT_URI, IS_MEMBER_OF))
                .thenReturn(
                        List.of(
                                triple(IS_MEMBER_OF, "test:b"),
                                triple(IS_MEMBER_OF, "test:a"),
                                triple(IS_MEMBER_OF, "")));
        RepositoryObject object = new RepositoryObject(Pid.parse("test:m"), rels);

        assertThat(manager.getParentPids(object)).containsExactlyInAnyOrder("test:a", "test:b");
    }

    @Test
    @DisplayName("getOtherParents() drops the excluded parent and tolerates a non-parent")
    void other_parents_excludes_one() {
        manager.addToCollection(member, collection);
        manager.addToCollection(member, otherCollection);
        RepositoryObject stranger = repository.ingest("test:stranger", "s", "admin", null);

        assertThat(manager.getOtherParents(member, collection)).containsExactly("test:other");
        assertThat(manager.getOtherParents(member, stranger))
                .isEqualTo(manager.getParentPids(member));
    }

    @Test
    @DisplayName("PID-based calls raise NotFoundException for missing objects")
    void pid_calls_require_existing_objects() {
        assertThatThrownBy(() -> manager.addToCollection("test:member", "test:missing"))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.removeFromCollection("test:ghost", "test:coll"))
                .isInstanceOf(NotFoundException.class);

        manager.addToCollection("test:member", "test:coll");
        assertThat(manager.getParentPids(member)).containsExactly("test:coll");
        manager.removeFromCollection("test:member", "test:coll");
        assertThat(manager.getParentPids(member)).isEmpty();
    }

    @Test
    @DisplayName("migrateMembers() moves members and keeps unrelated parents")
    void migrate_moves_members() {
        RepositoryObject third = repository.ingest("test:third", "t", "admin", null);
        RepositoryObject second = repository.ingest("test:second", "s", "admin", null);
        manager.addToCollection(member, collection);
        manager.addToCollection(member, third);
        second.relationships().add(RELS_EXT_URI, IS_MEMBER_OF, "test:coll");

        manager.migrateMembers(collection, otherCollection, List.of(member, second));

        assertThat(manager.getParentPids(member))
                .containsExactlyInAnyOrder("test:third", "test:other");
        assertThat(manager.getParentPids(second)).containsExactly("test:other");
    }

    @Test
    @DisplayName("migrateMembers() onto the same collection changes nothing")
    void migrate_to_same_collection_is_noop() {
        manager.addToCollection(member, collection);

        manager.migrateMembers(collection, collection, List.of(member));

        assertThat(manager.getParentPids(member)).containsExactly("test:coll");
    }

    @Test
    @DisplayName("shareMembers() adds the target as an extra parent")
    void share_adds_parent() {
        manager.addToCollection(member, collection);

        manager.shareMembers(otherCollection, List.of(member));
        manager.shareMembers(otherCollection, List.of(member));

        assertThat(manager.getParentPids(member))
                .containsExactlyInAnyOrder("test:coll", "test:other");
    }

    private static RelationshipTriple triple(String predicateName, String value) {
        return new RelationshipTriple("test:m", RELS_EXT_URI, predicateName, value);
    }
}
