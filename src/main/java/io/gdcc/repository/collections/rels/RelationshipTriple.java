package io.gdcc.repository.collections.rels;

/**
 * One outgoing relationship of a repository object.
 *
 * @param predicateUri namespace URI of the predicate
 * @param predicateName local name of the predicate
 * @param objectValue PID of the target object, or the lexical form when {@code literal}
 */
public record RelationshipTriple(
        String subjectPid,
        String predicateUri,
        String predicateName,
        String objectValue,
        boolean literal) {

    public RelationshipTriple(
            String subjectPid, String predicateUri, String predicateName, String objectValue) {
        this(subjectPid, predicateUri, predicateName, objectValue, false);
    }
}
