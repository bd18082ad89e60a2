package io.gdcc.repository.collections.error;

/** Base type for failures raised by collection membership and listing operations. */
public class CollectionException extends RuntimeException {
    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
