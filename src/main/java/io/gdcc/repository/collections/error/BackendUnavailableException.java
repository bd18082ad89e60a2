package io.gdcc.repository.collections.error;

/**
 * The query service could not be reached or failed while executing a query. Surfaced to the
 * caller as-is; nothing in this library retries.
 */
public class BackendUnavailableException extends CollectionException {
    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
