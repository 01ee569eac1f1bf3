package org.gpsagents.frontier.store;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Fallback store for when SQLite cannot be loaded: a sorted in-memory map mirrored to a snapshot file.
 *
 * <p>Every successful write builds a new copy of the map, writes the whole copy to a temporary file, renames it
 * over the snapshot and only then publishes the copy to readers. A failed write therefore leaves both the file and
 * the in-memory state as they were. The price is O(total entries) work per mutation, which is fine as a safety net
 * for small frontiers but does not scale.</p>
 */
public class FileStateStore implements StateStore {
    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);
    static final String SNAPSHOT_FILE = "frontier.jsonl";

    private final Path directory;
    private final Path snapshotFile;
    private final Path tempFile;
    private final DirectoryLock lock;
    private final SnapshotFormat format;
    private final Lock writeLock = new ReentrantLock();
    private volatile NavigableMap<byte[], byte[]> data;

    private FileStateStore(Path directory, DirectoryLock lock, SnapshotFormat format) {
        this.directory = directory;
        this.snapshotFile = directory.resolve(SNAPSHOT_FILE);
        this.tempFile = directory.resolve(SNAPSHOT_FILE + ".tmp");
        this.lock = lock;
        this.format = format;
    }

    public static FileStateStore open(Path directory, SnapshotFormat format) {
        DirectoryLock lock = DirectoryLock.acquire(directory);
        try {
            var store = new FileStateStore(directory, lock, format);
            store.data = Collections.unmodifiableNavigableMap(store.load());
            log.info("Opened snapshot store {} with {} entries", store.snapshotFile, store.data.size());
            return store;
        } catch (RuntimeException e) {
            lock.close();
            throw e;
        }
    }

    private NavigableMap<byte[], byte[]> load() {
        if (!Files.exists(snapshotFile)) return Keys.newSortedMap();
        try (BufferedReader reader = Files.newBufferedReader(snapshotFile, UTF_8)) {
            return format.read(reader);
        } catch (IOException e) {
            throw new StoreUnavailableException("Unable to read snapshot " + snapshotFile, e);
        }
    }

    @Override
    public @Nullable byte[] get(byte[] key) {
        byte[] value = data.get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public List<KeyValue> scan(byte[] prefix, byte @Nullable [] startAfter, int limit) {
        var snapshot = data;
        NavigableMap<byte[], byte[]> tail = startAfter != null && Keys.compare(startAfter, prefix) >= 0
                ? snapshot.tailMap(startAfter, false)
                : snapshot.tailMap(prefix, true);
        var result = new ArrayList<KeyValue>();
        for (Map.Entry<byte[], byte[]> entry : tail.entrySet()) {
            if (result.size() >= limit || !Keys.startsWith(entry.getKey(), prefix)) break;
            result.add(new KeyValue(entry.getKey().clone(), entry.getValue().clone()));
        }
        return result;
    }

    @Override
    public long count(byte[] prefix) {
        var snapshot = data;
        return snapshot.subMap(prefix, true, Keys.prefixEnd(prefix), false).size();
    }

    @Override
    public boolean write(WriteBatch batch) {
        writeLock.lock();
        try {
            var current = data;
            for (WriteBatch.Precondition precondition : batch.preconditions()) {
                if (!precondition.test(current.get(precondition.key()))) return false;
            }
            if (batch.isEmpty()) return true;
            NavigableMap<byte[], byte[]> next = Keys.newSortedMap();
            next.putAll(current);
            for (WriteBatch.Operation operation : batch.operations()) {
                if (operation instanceof WriteBatch.Put put) {
                    next.put(put.key(), put.value());
                } else {
                    next.remove(operation.key());
                }
            }
            persist(next);
            data = Collections.unmodifiableNavigableMap(next);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    private void persist(NavigableMap<byte[], byte[]> entries) {
        try {
            try (Writer writer = Files.newBufferedWriter(tempFile, UTF_8)) {
                format.write(entries, writer);
            }
            Files.move(tempFile, snapshotFile, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            var failure = new StateStoreException("Unable to write snapshot " + snapshotFile, e);
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            Files.deleteIfExists(snapshotFile);
            data = Collections.unmodifiableNavigableMap(Keys.newSortedMap());
        } catch (IOException e) {
            throw new StateStoreException("Unable to delete snapshot " + snapshotFile, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Path directory() {
        return directory;
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            lock.close();
            log.info("Closed snapshot store {}", snapshotFile);
        } finally {
            writeLock.unlock();
        }
    }
}
