package org.gpsagents.frontier.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the state store for a directory with an explicitly chosen backend.
 */
public final class StateStores {
    private static final Logger log = LoggerFactory.getLogger(StateStores.class);

    private StateStores() {
    }

    public static StateStore open(Path directory, Backend backend, SnapshotFormat snapshotFormat) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreUnavailableException("Unable to create frontier directory " + directory, e);
        }
        return switch (backend) {
            case EMBEDDED -> {
                if (!SqliteStateStore.isAvailable()) {
                    throw new StoreUnavailableException("SQLite native library is not available");
                }
                yield SqliteStateStore.open(directory);
            }
            case FILE -> FileStateStore.open(directory, snapshotFormat);
            case AUTO -> {
                if (SqliteStateStore.isAvailable()) {
                    yield SqliteStateStore.open(directory);
                }
                log.warn("SQLite native library is not available, falling back to snapshot file store in {}. " +
                         "Every mutation rewrites the whole snapshot.", directory);
                yield FileStateStore.open(directory, snapshotFormat);
            }
        };
    }
}
