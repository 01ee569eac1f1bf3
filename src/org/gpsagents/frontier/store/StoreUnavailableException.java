package org.gpsagents.frontier.store;

/**
 * A store could not be opened: the directory is unusable or the requested backend cannot be loaded. Not retried.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
