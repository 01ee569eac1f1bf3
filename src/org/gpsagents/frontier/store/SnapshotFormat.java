package org.gpsagents.frontier.store;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.NavigableMap;

/**
 * Converts the contents of a {@link FileStateStore} to and from its snapshot file.
 */
public interface SnapshotFormat {
    void write(NavigableMap<byte[], byte[]> entries, Writer out) throws IOException;

    /**
     * Rebuilds the store contents from a snapshot. The returned map must be ordered by {@link Keys#compare}.
     */
    NavigableMap<byte[], byte[]> read(BufferedReader in) throws IOException;
}
