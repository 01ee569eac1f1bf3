package org.gpsagents.frontier.store;

/**
 * A storage operation failed. The operation made no partial change and may be retried.
 */
public class StateStoreException extends RuntimeException {
    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
