package org.gpsagents.frontier.store;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * An ordered key-value store with atomic, conditional batch writes.
 *
 * <p>Implementations must keep keys in unsigned byte order, apply each {@link WriteBatch} all-or-nothing and leave
 * the store unchanged when a write throws {@link StateStoreException}.</p>
 */
public interface StateStore extends AutoCloseable {
    int SCAN_PAGE_SIZE = 512;

    @Nullable byte[] get(byte[] key);

    /**
     * Returns up to {@code limit} entries whose keys start with {@code prefix}, in ascending key order, beginning
     * after {@code startAfter} when it is given.
     */
    List<KeyValue> scan(byte[] prefix, byte @Nullable [] startAfter, int limit);

    long count(byte[] prefix);

    /**
     * Atomically applies the batch if all its preconditions hold.
     *
     * @return false if a precondition failed, in which case nothing was written
     * @throws StateStoreException if the underlying storage failed; nothing was written
     */
    boolean write(WriteBatch batch);

    /**
     * Removes every entry.
     */
    void clear();

    Path directory();

    @Override
    void close();

    default void put(byte[] key, byte[] value) {
        write(new WriteBatch().put(key, value));
    }

    default void delete(byte[] key) {
        write(new WriteBatch().delete(key));
    }

    /**
     * Visits every entry under {@code prefix} in key order. Entries are fetched a page at a time, so the action
     * may call back into the store.
     */
    default void forEach(byte[] prefix, Consumer<KeyValue> action) {
        byte[] after = null;
        while (true) {
            List<KeyValue> page = scan(prefix, after, SCAN_PAGE_SIZE);
            for (KeyValue entry : page) {
                action.accept(entry);
            }
            if (page.size() < SCAN_PAGE_SIZE) return;
            after = page.get(page.size() - 1).key();
        }
    }
}
