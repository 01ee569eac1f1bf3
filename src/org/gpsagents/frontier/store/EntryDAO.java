package org.gpsagents.frontier.store;

import org.jdbi.v3.sqlobject.SingleValue;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * SQL access to the single {@code entries} table. Keys are BLOBs, which SQLite orders with memcmp.
 */
@RegisterConstructorMapper(EntryDAO.Row.class)
public interface EntryDAO {
    @SqlQuery("SELECT v FROM entries WHERE k = ?")
    @SingleValue
    @Nullable byte[] get(byte[] key);

    @SqlUpdate("INSERT INTO entries (k, v) VALUES (:key, :value) ON CONFLICT (k) DO UPDATE SET v = excluded.v")
    void put(byte[] key, byte[] value);

    @SqlUpdate("DELETE FROM entries WHERE k = ?")
    void delete(byte[] key);

    @SqlQuery("SELECT k, v FROM entries WHERE k >= :prefix AND k < :end ORDER BY k LIMIT :limit")
    List<Row> scanFrom(byte[] prefix, byte[] end, int limit);

    @SqlQuery("SELECT k, v FROM entries WHERE k > :after AND k < :end ORDER BY k LIMIT :limit")
    List<Row> scanAfter(byte[] after, byte[] end, int limit);

    @SqlQuery("SELECT COUNT(*) FROM entries WHERE k >= :prefix AND k < :end")
    long count(byte[] prefix, byte[] end);

    @SqlUpdate("DELETE FROM entries")
    void deleteAll();

    record Row(byte[] k, byte[] v) {
        KeyValue toKeyValue() {
            return new KeyValue(k, v);
        }
    }
}
