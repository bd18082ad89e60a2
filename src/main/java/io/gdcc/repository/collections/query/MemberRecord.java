package io.gdcc.repository.collections.query;

import java.time.Instant;

/**
 * A member of a collection as returned by a query. Only the PID is always present.
 *
 * @param title object label, or {@code null}
 * @param owner owner id, or {@code null}
 * @param modified last modification, or {@code null}
 */
public record MemberRecord(String pid, String title, String owner, Instant modified) {}
