package org.gpsagents.frontier.store;

/**
 * State store implementation to open.
 */
public enum Backend {
    /**
     * Embedded SQLite if its native library loads, otherwise the snapshot file store.
     */
    AUTO,
    /**
     * Embedded SQLite. Opening fails if the native library is unavailable.
     */
    EMBEDDED,
    /**
     * In-memory map mirrored to a line-delimited JSON snapshot.
     */
    FILE
}
