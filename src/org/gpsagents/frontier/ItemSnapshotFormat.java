package org.gpsagents.frontier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.gpsagents.frontier.store.Keys;
import org.gpsagents.frontier.store.SnapshotFormat;
import org.gpsagents.frontier.store.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshot of the frontier as one JSON record per item.
 *
 * <p>Each line holds the item fields plus {@code status} ({@code pending}, {@code processing}, {@code completed}
 * or {@code failed}), {@code leased_at} for processing items and {@code finished_at} for completed and failed
 * ones. Queue keys and seen entries are not written; they are rebuilt from the items on load.</p>
 *
 * <p>Lines that nest the item fields under an {@code item} object, with {@code status} beside it, are read as
 * well.</p>
 */
public class ItemSnapshotFormat implements SnapshotFormat {
    private static final Logger log = LoggerFactory.getLogger(ItemSnapshotFormat.class);
    private static final String STATUS = "status";
    private static final String LEASED_AT = "leased_at";
    private static final String FINISHED_AT = "finished_at";
    private static final String ITEM = "item";

    private final ItemCodec codec;

    public ItemSnapshotFormat(ItemCodec codec) {
        this.codec = codec;
    }

    @Override
    public void write(NavigableMap<byte[], byte[]> entries, Writer out) throws IOException {
        Set<UUID> pending = new HashSet<>();
        for (byte[] id : region(entries, QueueKeys.PENDING).values()) {
            pending.add(QueueKeys.parseIdValue(id));
        }
        for (Map.Entry<byte[], byte[]> entry : region(entries, QueueKeys.ITEM).entrySet()) {
            UUID id = QueueKeys.idFromKey(QueueKeys.ITEM, entry.getKey());
            ObjectNode node = codec.toTree(codec.decode(entry.getValue()));
            byte[] lease = entries.get(QueueKeys.processing(id));
            byte[] completed = entries.get(QueueKeys.completed(id));
            byte[] failed = entries.get(QueueKeys.failed(id));
            if (lease != null) {
                node.put(STATUS, ItemState.PROCESSING.tag());
                node.put(LEASED_AT, codec.decodeLease(lease).toString());
            } else if (completed != null) {
                node.put(STATUS, ItemState.COMPLETED.tag());
                node.put(FINISHED_AT, codec.decodeOutcome(completed).toString());
            } else if (failed != null) {
                node.put(STATUS, ItemState.FAILED.tag());
                node.put(FINISHED_AT, codec.decodeOutcome(failed).toString());
            } else if (pending.contains(id)) {
                node.put(STATUS, ItemState.PENDING.tag());
            } else {
                log.warn("Item {} is in no queue state, leaving it out of the snapshot", id);
                continue;
            }
            out.write(codec.mapper().writeValueAsString(node));
            out.write('\n');
        }
    }

    @Override
    public NavigableMap<byte[], byte[]> read(BufferedReader in) throws IOException {
        NavigableMap<byte[], byte[]> entries = Keys.newSortedMap();
        int lineNumber = 0;
        for (String line = in.readLine(); line != null; line = in.readLine()) {
            lineNumber++;
            if (line.isBlank()) continue;
            try {
                readRecord(line, entries);
            } catch (IOException | IllegalArgumentException | DateTimeException | StateStoreException e) {
                log.warn("Skipping unreadable snapshot line {}: {}", lineNumber, e.getMessage());
            }
        }
        return entries;
    }

    private void readRecord(String line, NavigableMap<byte[], byte[]> entries) throws IOException {
        JsonNode tree = codec.mapper().readTree(line);
        if (!(tree instanceof ObjectNode node)) throw new IllegalArgumentException("not a JSON object");
        JsonNode status = node.remove(STATUS);
        JsonNode leasedAt = node.remove(LEASED_AT);
        JsonNode finishedAt = node.remove(FINISHED_AT);
        // older snapshots wrap the item fields: {"item": {...}, "status": "pending"}
        CrawlItem item = codec.fromTree(node.get(ITEM) instanceof ObjectNode wrapped ? wrapped : node);
        ItemState state = status == null ? ItemState.PENDING : ItemState.fromTag(status.asText());
        UUID id = item.id();

        entries.put(QueueKeys.item(id), codec.encode(item));
        entries.put(QueueKeys.seen(item.fingerprint()), QueueKeys.seenMarker());
        switch (state) {
            case PENDING -> entries.put(QueueKeys.encode(item), QueueKeys.idValue(id));
            case PROCESSING -> entries.put(QueueKeys.processing(id),
                    codec.encodeLease(timestampOr(leasedAt, item.createdAt())));
            case COMPLETED -> entries.put(QueueKeys.completed(id),
                    codec.encodeOutcome(timestampOr(finishedAt, item.createdAt())));
            case FAILED -> entries.put(QueueKeys.failed(id),
                    codec.encodeOutcome(timestampOr(finishedAt, item.createdAt())));
        }
    }

    private static Instant timestampOr(JsonNode node, Instant fallback) {
        return node == null || node.isNull() ? fallback : Instant.parse(node.asText());
    }

    private static NavigableMap<byte[], byte[]> region(NavigableMap<byte[], byte[]> entries, String prefix) {
        byte[] start = QueueKeys.region(prefix);
        return entries.subMap(start, true, Keys.prefixEnd(start), false);
    }
}
