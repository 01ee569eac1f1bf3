package org.gpsagents.frontier.store;

import java.nio.file.Path;

public class StoreLockedException extends StoreUnavailableException {
    public StoreLockedException(Path directory) {
        super("Frontier directory is already open: " + directory);
    }
}
