package io.gdcc.repository.collections.query;

import io.gdcc.repository.collections.error.InvalidArgumentException;

/**
 * @param page zero-based page number
 * @param limit page size, greater than zero
 */
public record PageRequest(int page, int limit) {
    public PageRequest {
        if (page < 0) {
            throw new InvalidArgumentException("page must be >= 0, was " + page);
        }
        if (limit <= 0) {
            throw new InvalidArgumentException("limit must be > 0, was " + limit);
        }
    }

    public long offset() {
        return (long) page * limit;
    }
}
