package org.gpsagents.frontier.store;

import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteJDBCLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * The primary store: one {@code WITHOUT ROWID} SQLite table whose primary key order is the key order.
 * Each {@link WriteBatch} runs in its own transaction.
 */
public class SqliteStateStore implements StateStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteStateStore.class);
    static final String DATABASE_DIRECTORY = "frontier.db";
    static final String DATABASE_FILE = "frontier.sqlite3";

    private final Path directory;
    private final DirectoryLock lock;
    private final KeyValueDatabase db;

    private SqliteStateStore(Path directory, DirectoryLock lock, KeyValueDatabase db) {
        this.directory = directory;
        this.lock = lock;
        this.db = db;
    }

    /**
     * Whether the SQLite native library can be loaded on this platform.
     */
    public static boolean isAvailable() {
        try {
            return SQLiteJDBCLoader.initialize();
        } catch (Exception | LinkageError e) {
            log.debug("SQLite native library failed to load", e);
            return false;
        }
    }

    public static SqliteStateStore open(Path directory) {
        DirectoryLock lock = DirectoryLock.acquire(directory);
        try {
            Path databaseDirectory = directory.resolve(DATABASE_DIRECTORY);
            Files.createDirectories(databaseDirectory);
            Path databaseFile = databaseDirectory.resolve(DATABASE_FILE);
            var store = new SqliteStateStore(directory, lock, KeyValueDatabase.open(databaseFile));
            log.info("Opened SQLite store {}", databaseFile);
            return store;
        } catch (IOException e) {
            lock.close();
            throw new StoreUnavailableException("Unable to create database directory in " + directory, e);
        } catch (RuntimeException e) {
            lock.close();
            throw new StoreUnavailableException("Unable to open SQLite store in " + directory, e);
        }
    }

    @Override
    public @Nullable byte[] get(byte[] key) {
        return guard("get", () -> db.entries().get(key));
    }

    @Override
    public List<KeyValue> scan(byte[] prefix, byte @Nullable [] startAfter, int limit) {
        byte[] end = Keys.prefixEnd(prefix);
        List<EntryDAO.Row> rows = guard("scan", () -> startAfter != null && Keys.compare(startAfter, prefix) >= 0
                ? db.entries().scanAfter(startAfter, end, limit)
                : db.entries().scanFrom(prefix, end, limit));
        return rows.stream().map(EntryDAO.Row::toKeyValue).toList();
    }

    @Override
    public long count(byte[] prefix) {
        return guard("count", () -> db.entries().count(prefix, Keys.prefixEnd(prefix)));
    }

    @Override
    public boolean write(WriteBatch batch) {
        return guard("write", () -> db.inTransaction(tx -> {
            EntryDAO entries = tx.entries();
            for (WriteBatch.Precondition precondition : batch.preconditions()) {
                if (!precondition.test(entries.get(precondition.key()))) return false;
            }
            for (WriteBatch.Operation operation : batch.operations()) {
                if (operation instanceof WriteBatch.Put put) {
                    entries.put(put.key(), put.value());
                } else {
                    entries.delete(operation.key());
                }
            }
            return true;
        }));
    }

    @Override
    public void clear() {
        guard("clear", () -> {
            db.entries().deleteAll();
            return null;
        });
    }

    @Override
    public Path directory() {
        return directory;
    }

    @Override
    public void close() {
        try {
            db.close();
        } catch (Exception e) {
            log.error("Failed to close SQLite store in {}", directory, e);
        } finally {
            lock.close();
        }
        log.info("Closed SQLite store in {}", directory);
    }

    private static <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (JdbiException e) {
            throw new StateStoreException("SQLite " + operation + " failed", e);
        }
    }
}
