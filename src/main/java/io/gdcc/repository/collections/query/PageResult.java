package io.gdcc.repository.collections.query;

import java.util.List;

/**
 * One page of collection members.
 *
 * @param totalCount number of members across all pages
 * @param items members on this page, at most {@code limit}
 */
public record PageResult(long totalCount, List<MemberRecord> items, int page, int limit) {
    public PageResult {
        items = List.copyOf(items);
    }

    public long totalPages() {
        return (totalCount + limit - 1) / limit;
    }

    public boolean hasNext() {
        return (long) (page + 1) * limit < totalCount;
    }
}
