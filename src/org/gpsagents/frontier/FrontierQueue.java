package org.gpsagents.frontier;

import org.gpsagents.frontier.config.FrontierConfig;
import org.gpsagents.frontier.store.Backend;
import org.gpsagents.frontier.store.KeyValue;
import org.gpsagents.frontier.store.StateStore;
import org.gpsagents.frontier.store.StateStoreException;
import org.gpsagents.frontier.store.StateStores;
import org.gpsagents.frontier.store.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Persistent priority queue of crawl items with deduplication and crash recovery.
 *
 * <p>Items move through pending, processing (leased to a worker), and finally completed or failed. Pending entries
 * are keyed so that the store's natural key order is processing order: priority tier, then creation time, then id.
 * Every transition is a single conditional {@link WriteBatch}; when two callers race for the same entry the loser's
 * batch is rejected and it moves on, so an item is never handed out twice.</p>
 *
 * <p>The queue starts no threads and may be shared between any number of worker threads. Stalled leases are only
 * released when a supervisor calls {@link #recoverStalled(Duration)}, see {@link StallSweeper}.</p>
 */
public class FrontierQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FrontierQueue.class);
    private static final int POP_SCAN_SIZE = 64;
    private static final int MAX_PUSH_ATTEMPTS = 16;
    private static final byte[] PENDING_PREFIX = QueueKeys.prefix();
    private static final byte[] PROCESSING_PREFIX = QueueKeys.region(QueueKeys.PROCESSING);
    private static final byte[] COMPLETED_PREFIX = QueueKeys.region(QueueKeys.COMPLETED);
    private static final byte[] FAILED_PREFIX = QueueKeys.region(QueueKeys.FAILED);
    private static final byte[] SEEN_PREFIX = QueueKeys.region(QueueKeys.SEEN);

    private final StateStore store;
    private final ItemCodec codec;
    private final Clock clock;

    public FrontierQueue(StateStore store) {
        this(store, new ItemCodec(), Clock.systemUTC());
    }

    public FrontierQueue(StateStore store, ItemCodec codec, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
    }

    public static FrontierQueue open(Path directory) {
        return open(directory, Backend.AUTO);
    }

    public static FrontierQueue open(Path directory, Backend backend) {
        return open(directory, backend, Clock.systemUTC());
    }

    public static FrontierQueue open(Path directory, Backend backend, Clock clock) {
        var codec = new ItemCodec();
        var store = StateStores.open(directory, backend, new ItemSnapshotFormat(codec));
        log.info("Opened frontier in {} using {}", directory, store.getClass().getSimpleName());
        return new FrontierQueue(store, codec, clock);
    }

    public static FrontierQueue open(FrontierConfig config) {
        return open(config.directory(), config.backend());
    }

    public boolean push(CrawlItem item) {
        return push(item, true);
    }

    /**
     * Adds an item unless its fingerprint has been seen before.
     *
     * @param checkDuplicate when false the item is enqueued even if its target was seen, and still marked as seen
     * @return true if the item was added
     */
    public boolean push(CrawlItem item, boolean checkDuplicate) {
        return pushMany(List.of(item), checkDuplicate) == 1;
    }

    public int pushMany(Collection<CrawlItem> items) {
        return pushMany(items, true);
    }

    /**
     * Adds several items in one atomic batch.
     *
     * <p>Duplicates, both of earlier pushes and within {@code items}, are skipped. If a concurrent producer commits
     * an overlapping fingerprint first the batch is rejected and rebuilt against the new state.</p>
     *
     * @return the number of items added
     */
    public int pushMany(Collection<CrawlItem> items, boolean checkDuplicate) {
        for (int attempt = 1; ; attempt++) {
            var batch = new WriteBatch();
            Set<String> batchFingerprints = new HashSet<>();
            Set<UUID> batchIds = new HashSet<>();
            int added = 0;
            for (CrawlItem item : items) {
                byte[] itemKey = QueueKeys.item(item.id());
                if (!batchIds.add(item.id()) || store.get(itemKey) != null) {
                    log.warn("Ignoring {}: an item with this id is already in the frontier", item.id());
                    continue;
                }
                String fingerprint = item.fingerprint();
                byte[] seenKey = QueueKeys.seen(fingerprint);
                if (checkDuplicate) {
                    if (batchFingerprints.contains(fingerprint) || store.get(seenKey) != null) {
                        log.debug("Skipping duplicate {} {}", item.adapterId(), item.target());
                        continue;
                    }
                    batch.requireAbsent(seenKey);
                }
                batchFingerprints.add(fingerprint);
                batch.requireAbsent(itemKey)
                        .put(seenKey, QueueKeys.seenMarker())
                        .put(itemKey, codec.encode(item))
                        .put(QueueKeys.encode(item), QueueKeys.idValue(item.id()));
                added++;
            }
            if (added == 0) return 0;
            if (store.write(batch)) {
                log.debug("Added {} of {} items", added, items.size());
                return added;
            }
            if (attempt >= MAX_PUSH_ATTEMPTS) {
                throw new StateStoreException("Push still conflicting with concurrent writers after " + attempt +
                                              " attempts");
            }
            log.debug("Push conflicted with a concurrent writer, retrying");
        }
    }

    /**
     * Leases the next item to the caller. The caller must later {@link #complete(UUID)} or {@link #fail(UUID)} it.
     *
     * <p>Queue entries whose item body is missing, left behind by a crash, are removed and skipped.</p>
     */
    public Optional<CrawlItem> pop() {
        byte[] after = null;
        while (true) {
            List<KeyValue> candidates = store.scan(PENDING_PREFIX, after, POP_SCAN_SIZE);
            if (candidates.isEmpty()) return Optional.empty();
            for (KeyValue entry : candidates) {
                after = entry.key();
                UUID id = QueueKeys.parseIdValue(entry.value());
                byte[] itemKey = QueueKeys.item(id);
                byte[] body = store.get(itemKey);
                if (body == null) {
                    removeOrphan(entry, itemKey);
                    continue;
                }
                byte[] leaseKey = QueueKeys.processing(id);
                var batch = new WriteBatch()
                        .requirePresent(entry.key())
                        .requireValue(itemKey, body)
                        .requireAbsent(leaseKey)
                        .delete(entry.key())
                        .put(leaseKey, codec.encodeLease(clock.instant()));
                if (store.write(batch)) {
                    CrawlItem item = codec.decode(body);
                    log.debug("Leased {} ({}, {})", id, item.priority(), item.target());
                    return Optional.of(item);
                }
                log.debug("Lost race for {}, trying the next entry", id);
            }
        }
    }

    private void removeOrphan(KeyValue entry, byte[] itemKey) {
        boolean removed = store.write(new WriteBatch()
                .requirePresent(entry.key())
                .requireAbsent(itemKey)
                .delete(entry.key()));
        if (removed) log.warn("Removed orphaned queue entry {}", entry.keyString());
    }

    /**
     * Returns up to {@code count} pending items in the order {@link #pop()} would return them, without changing
     * any state.
     */
    public List<CrawlItem> peek(int count) {
        var items = new ArrayList<CrawlItem>();
        byte[] after = null;
        while (items.size() < count) {
            List<KeyValue> page = store.scan(PENDING_PREFIX, after, Math.max(count - items.size(), POP_SCAN_SIZE));
            if (page.isEmpty()) break;
            for (KeyValue entry : page) {
                after = entry.key();
                byte[] body = store.get(QueueKeys.item(QueueKeys.parseIdValue(entry.value())));
                if (body == null) continue;
                items.add(codec.decode(body));
                if (items.size() >= count) break;
            }
        }
        return items;
    }

    /**
     * Marks a leased item as completed.
     *
     * @return false if the item is not currently leased, e.g. it was already completed or recovered
     */
    public boolean complete(UUID itemId) {
        byte[] leaseKey = QueueKeys.processing(itemId);
        byte[] lease = store.get(leaseKey);
        if (lease == null) return false;
        boolean completed = store.write(new WriteBatch()
                .requireValue(leaseKey, lease)
                .delete(leaseKey)
                .put(QueueKeys.completed(itemId), codec.encodeOutcome(clock.instant())));
        if (completed) log.debug("Completed {}", itemId);
        return completed;
    }

    public boolean fail(UUID itemId) {
        return fail(itemId, true);
    }

    /**
     * Records a failed attempt of a leased item. The retry count is incremented; if {@code requeue} is set and
     * retries remain the item goes back to pending one priority tier lower, otherwise it is moved to failed.
     *
     * @return false if the item is not currently leased
     */
    public boolean fail(UUID itemId, boolean requeue) {
        byte[] lease = store.get(QueueKeys.processing(itemId));
        if (lease == null) return false;
        return releaseFailed(itemId, lease, requeue) != Release.LOST;
    }

    private enum Release {
        LOST, REQUEUED, FAILED
    }

    private Release releaseFailed(UUID itemId, byte[] lease, boolean requeue) {
        byte[] leaseKey = QueueKeys.processing(itemId);
        byte[] itemKey = QueueKeys.item(itemId);
        byte[] body = store.get(itemKey);
        if (body == null) {
            log.warn("Lease {} has no item body, discarding it", itemId);
            store.write(new WriteBatch().requireValue(leaseKey, lease).delete(leaseKey));
            return Release.LOST;
        }
        CrawlItem previous = codec.decode(body);
        CrawlItem item = previous.withRetryCount(previous.retryCount() + 1);
        var batch = new WriteBatch()
                .requireValue(leaseKey, lease)
                .requireValue(itemKey, body)
                .delete(leaseKey);
        boolean requeued = requeue && item.retryCount() < item.maxRetries();
        if (requeued) {
            item = item.withPriority(item.priority().demote());
            batch.put(itemKey, codec.encode(item))
                    .put(QueueKeys.encode(item), QueueKeys.idValue(itemId));
        } else {
            batch.put(itemKey, codec.encode(item))
                    .put(QueueKeys.failed(itemId), codec.encodeOutcome(clock.instant()));
        }
        if (!store.write(batch)) return Release.LOST;
        if (requeued) {
            log.debug("Requeued {} at {} (attempt {} of {})", itemId, item.priority(), item.retryCount(),
                    item.maxRetries());
        } else {
            log.info("Gave up on {} after {} attempts", itemId, item.retryCount());
        }
        return requeued ? Release.REQUEUED : Release.FAILED;
    }

    /**
     * Treats every lease older than {@code timeout} as abandoned by a crashed worker and applies
     * {@code fail(id, true)} to it.
     *
     * @return the number of stalled items put back in the queue; items out of retries move to failed and are not
     * counted
     */
    public int recoverStalled(Duration timeout) {
        if (timeout.isNegative()) throw new IllegalArgumentException("timeout must not be negative");
        Instant now = clock.instant();
        var stalled = new ArrayList<KeyValue>();
        store.forEach(PROCESSING_PREFIX, entry -> {
            Instant leasedAt = codec.decodeLease(entry.value());
            if (Duration.between(leasedAt, now).compareTo(timeout) > 0) {
                stalled.add(entry);
            }
        });
        int recovered = 0;
        for (KeyValue entry : stalled) {
            UUID id = QueueKeys.idFromKey(QueueKeys.PROCESSING, entry.key());
            if (releaseFailed(id, entry.value(), true) == Release.REQUEUED) recovered++;
        }
        if (recovered > 0) log.info("Recovered {} stalled items", recovered);
        return recovered;
    }

    public boolean isDuplicate(CrawlItem item) {
        return store.get(QueueKeys.seen(item.fingerprint())) != null;
    }

    public Optional<FrontierEntry> find(UUID itemId) {
        byte[] body = store.get(QueueKeys.item(itemId));
        if (body == null) return Optional.empty();
        ItemState state;
        if (store.get(QueueKeys.processing(itemId)) != null) {
            state = ItemState.PROCESSING;
        } else if (store.get(QueueKeys.completed(itemId)) != null) {
            state = ItemState.COMPLETED;
        } else if (store.get(QueueKeys.failed(itemId)) != null) {
            state = ItemState.FAILED;
        } else {
            state = ItemState.PENDING;
        }
        return Optional.of(new FrontierEntry(codec.decode(body), state));
    }

    public List<CrawlItem> failedItems(int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must not be negative");
        var items = new ArrayList<CrawlItem>();
        for (KeyValue entry : store.scan(FAILED_PREFIX, null, limit)) {
            byte[] body = store.get(QueueKeys.item(QueueKeys.idFromKey(QueueKeys.FAILED, entry.key())));
            if (body != null) items.add(codec.decode(body));
        }
        return items;
    }

    public FrontierStats stats() {
        long pending = store.count(PENDING_PREFIX);
        long processing = store.count(PROCESSING_PREFIX);
        long completed = store.count(COMPLETED_PREFIX);
        long failed = store.count(FAILED_PREFIX);
        long unique = store.count(SEEN_PREFIX);
        Map<Priority, Long> byPriority = new EnumMap<>(Priority.class);
        Map<String, Long> byAdapter = new TreeMap<>();
        store.forEach(PENDING_PREFIX, entry -> {
            byte[] body = store.get(QueueKeys.item(QueueKeys.parseIdValue(entry.value())));
            if (body == null) return;
            CrawlItem item = codec.decode(body);
            byPriority.merge(item.priority(), 1L, Long::sum);
            String adapter = item.adapterId().isBlank() ? "unknown" : item.adapterId();
            byAdapter.merge(adapter, 1L, Long::sum);
        });
        return new FrontierStats(pending + processing + completed + failed, pending, processing, completed, failed,
                unique, byPriority, byAdapter);
    }

    public long size() {
        return store.count(PENDING_PREFIX);
    }

    public boolean isEmpty() {
        return store.scan(PENDING_PREFIX, null, 1).isEmpty();
    }

    // also forgets every seen fingerprint
    public void clear() {
        store.clear();
        log.info("Cleared frontier in {}", store.directory());
    }

    @Override
    public void close() {
        store.close();
    }
}
