package io.gdcc.repository.collections.rels;

/** Fedora relationship and model vocabulary used for collection membership. */
public final class Vocabulary {
    /** Prefix turning a PID into a resource URI, e.g. {@code info:fedora/test:1}. */
    public static final String FEDORA_URI_PREFIX = "info:fedora/";

    /** RELS-EXT namespace, known in repository APIs as "fedora-rels-ext". */
    public static final String RELS_EXT_URI = "info:fedora/fedora-system:def/relations-external#";

    public static final String FEDORA_MODEL_URI = "info:fedora/fedora-system:def/model#";
    public static final String FEDORA_VIEW_URI = "info:fedora/fedora-system:def/view#";

    public static final String IS_MEMBER_OF_COLLECTION = "isMemberOfCollection";

    /** Older membership predicate still found on migrated objects. */
    public static final String IS_MEMBER_OF = "isMemberOf";

    public static final String HAS_MODEL = "hasModel";
    public static final String LABEL = "label";
    public static final String OWNER_ID = "ownerId";
    public static final String STATE = "state";
    public static final String LAST_MODIFIED_DATE = "lastModifiedDate";

    public static final String STATE_ACTIVE = FEDORA_MODEL_URI + "Active";
    public static final String STATE_INACTIVE = FEDORA_MODEL_URI + "Inactive";
    public static final String STATE_DELETED = FEDORA_MODEL_URI + "Deleted";

    public static final String COLLECTION_CONTENT_MODEL = "islandora:collectionCModel";

    private Vocabulary() {}

    public static String toUri(String pid) {
        return pid.startsWith(FEDORA_URI_PREFIX) ? pid : FEDORA_URI_PREFIX + pid;
    }

    /** Strips the {@code info:fedora/} prefix; other URIs are returned unchanged. */
    public static String toPid(String uri) {
        if (uri == null) {
            return null;
        }
        return uri.startsWith(FEDORA_URI_PREFIX) ? uri.substring(FEDORA_URI_PREFIX.length()) : uri;
    }
}
