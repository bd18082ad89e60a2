package io.gdcc.repository.collections.query;

/** Which members a listing may show. */
public enum FilterMode {
    /** Active members only; objects without a state count as active. */
    VIEW,
    /** Everything except deleted members, for collection management screens. */
    MANAGE
}
