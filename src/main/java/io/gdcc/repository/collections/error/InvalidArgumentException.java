package io.gdcc.repository.collections.error;

/** Rejected input (PID format, page, limit) detected before any query is issued. */
public class InvalidArgumentException extends CollectionException {
    public InvalidArgumentException(String message) {
        super(message);
    }
}
