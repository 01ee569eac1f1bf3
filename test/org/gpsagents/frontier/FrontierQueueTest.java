package org.gpsagents.frontier;

import org.gpsagents.frontier.store.Backend;
import org.gpsagents.frontier.store.StateStore;
import org.gpsagents.frontier.store.StateStores;
import org.gpsagents.frontier.store.StoreLockedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FrontierQueueTest {
    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path dir;
    private final MutableClock clock = new MutableClock(T0);
    private FrontierQueue frontier;

    @AfterEach
    void tearDown() {
        if (frontier != null) frontier.close();
    }

    private FrontierQueue open(Backend backend) {
        frontier = FrontierQueue.open(dir, backend, clock);
        return frontier;
    }

    private static CrawlItem url(String url, Priority priority, Instant createdAt) {
        return CrawlItem.ofUrl(url, "web").withPriority(priority).withCreatedAt(createdAt);
    }

    private static CrawlItem popRequired(FrontierQueue frontier) {
        return frontier.pop().orElseThrow(() -> new AssertionError("expected an item"));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testPopOrdersByPriorityThenAge(Backend backend) {
        var frontier = open(backend);
        frontier.push(url("https://example.org/high", Priority.HIGH, T0));
        frontier.push(url("https://example.org/critical", Priority.CRITICAL, T0.plusSeconds(60)));
        frontier.push(url("https://example.org/normal", Priority.NORMAL, T0.minusSeconds(60)));

        assertEquals(Priority.CRITICAL, popRequired(frontier).priority());
        assertEquals(Priority.HIGH, popRequired(frontier).priority());
        assertEquals(Priority.NORMAL, popRequired(frontier).priority());
        assertTrue(frontier.pop().isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testFifoWithinTier(Backend backend) {
        var frontier = open(backend);
        CrawlItem a = url("https://example.org/a", Priority.NORMAL, T0);
        CrawlItem b = url("https://example.org/b", Priority.NORMAL, T0.plusNanos(1000));
        CrawlItem background = url("https://example.org/c", Priority.BACKGROUND, T0.minusSeconds(3600));
        CrawlItem low = url("https://example.org/d", Priority.LOW, T0.plusSeconds(3600));
        frontier.pushMany(List.of(background, b, low, a));

        assertEquals(a.id(), popRequired(frontier).id());
        assertEquals(b.id(), popRequired(frontier).id());
        assertEquals(low.id(), popRequired(frontier).id());
        assertEquals(background.id(), popRequired(frontier).id());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testDuplicateIsRejected(Backend backend) {
        var frontier = open(backend);
        assertTrue(frontier.push(CrawlItem.ofUrl("https://x", "a")));
        assertFalse(frontier.push(CrawlItem.ofUrl("https://x", "a").withPriority(Priority.CRITICAL)));
        assertEquals(1, frontier.size());
        assertEquals(1, frontier.stats().pendingItems());
        assertTrue(frontier.isDuplicate(CrawlItem.ofUrl("https://x", "a")));
        assertFalse(frontier.isDuplicate(CrawlItem.ofUrl("https://x", "b")));

        // still a duplicate once the first copy is done
        frontier.complete(popRequired(frontier).id());
        assertFalse(frontier.push(CrawlItem.ofUrl("https://x", "a")));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testPushWithoutDuplicateCheck(Backend backend) {
        var frontier = open(backend);
        assertTrue(frontier.push(CrawlItem.ofUrl("https://x", "a")));
        assertTrue(frontier.push(CrawlItem.ofUrl("https://x", "a"), false));
        assertEquals(2, frontier.size());
        assertEquals(1, frontier.stats().uniqueFingerprints());

        CrawlItem item = CrawlItem.ofUrl("https://y", "a");
        assertTrue(frontier.push(item, false));
        assertTrue(frontier.isDuplicate(item));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testPushManyDeduplicatesWithinBatch(Backend backend) {
        var frontier = open(backend);
        frontier.push(CrawlItem.ofUrl("https://example.org/1", "web"));
        int added = frontier.pushMany(List.of(
                CrawlItem.ofUrl("https://example.org/1", "web"),
                CrawlItem.ofUrl("https://example.org/2", "web"),
                CrawlItem.ofUrl("https://example.org/2", "web"),
                CrawlItem.ofQuery(Map.of("q", "2"), "web")));
        assertEquals(2, added);
        assertEquals(3, frontier.size());
        assertEquals(0, frontier.pushMany(List.of()));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testPushIgnoresKnownId(Backend backend) {
        var frontier = open(backend);
        CrawlItem item = CrawlItem.ofUrl("https://example.org/1", "web");
        assertTrue(frontier.push(item));
        assertFalse(frontier.push(new CrawlItem(item.id(), new CrawlTarget.Url("https://example.org/other"), "web",
                Priority.HIGH, null, null, null, T0, null, 0, 3)));
        assertEquals(1, frontier.size());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testCompleteOnlyOnce(Backend backend) {
        var frontier = open(backend);
        CrawlItem item = CrawlItem.ofUrl("https://example.org/", "web");
        frontier.push(item);
        assertFalse(frontier.complete(item.id()), "never popped");

        CrawlItem popped = popRequired(frontier);
        assertTrue(frontier.complete(popped.id()));
        assertFalse(frontier.complete(popped.id()));
        assertFalse(frontier.fail(popped.id()));
        assertFalse(frontier.complete(UUID.randomUUID()));

        assertEquals(ItemState.COMPLETED, frontier.find(item.id()).orElseThrow().state());
        FrontierStats stats = frontier.stats();
        assertEquals(1, stats.completedItems());
        assertEquals(1, stats.totalItems());
        assertTrue(frontier.isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testRetriesExhaustedEndsInFailed(Backend backend) {
        var frontier = open(backend);
        CrawlItem item = CrawlItem.ofUrl("https://example.org/flaky", "web").withMaxRetries(2);
        frontier.push(item);

        assertTrue(frontier.fail(popRequired(frontier).id()));
        assertEquals(ItemState.PENDING, frontier.find(item.id()).orElseThrow().state());
        assertTrue(frontier.fail(popRequired(frontier).id()));
        assertTrue(frontier.pop().isEmpty());

        FrontierEntry entry = frontier.find(item.id()).orElseThrow();
        assertEquals(ItemState.FAILED, entry.state());
        assertEquals(2, entry.item().retryCount());
        assertEquals(1, frontier.stats().failedItems());
        assertEquals(List.of(item.id()), frontier.failedItems(10).stream().map(CrawlItem::id).toList());
        assertEquals(0, frontier.size());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testFailDemotesOneTier(Backend backend) {
        var frontier = open(backend);
        CrawlItem item = url("https://example.org/", Priority.LOW, T0).withMaxRetries(10);
        frontier.push(item);

        List<Priority> seen = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            CrawlItem popped = popRequired(frontier);
            seen.add(popped.priority());
            assertEquals(i, popped.retryCount());
            assertTrue(frontier.fail(popped.id(), true));
        }
        assertEquals(List.of(Priority.LOW, Priority.BACKGROUND, Priority.BACKGROUND), seen);
        CrawlItem requeued = frontier.find(item.id()).orElseThrow().item();
        assertEquals(Priority.BACKGROUND, requeued.priority());
        assertEquals(3, requeued.retryCount());
        assertEquals(item.createdAt(), requeued.createdAt());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testFailWithoutRequeue(Backend backend) {
        var frontier = open(backend);
        frontier.push(CrawlItem.ofUrl("https://example.org/", "web"));
        CrawlItem popped = popRequired(frontier);
        assertTrue(frontier.fail(popped.id(), false));

        FrontierEntry entry = frontier.find(popped.id()).orElseThrow();
        assertEquals(ItemState.FAILED, entry.state());
        assertEquals(1, entry.item().retryCount());
        assertTrue(frontier.pop().isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testRecoverStalled(Backend backend) {
        var frontier = open(backend);
        frontier.push(url("https://example.org/", Priority.HIGH, T0));
        CrawlItem popped = popRequired(frontier);

        assertEquals(0, frontier.recoverStalled(Duration.ofMinutes(5)), "fresh lease");
        assertEquals(ItemState.PROCESSING, frontier.find(popped.id()).orElseThrow().state());

        clock.advance(Duration.ofMinutes(6));
        assertEquals(1, frontier.recoverStalled(Duration.ofMinutes(5)));
        CrawlItem recovered = popRequired(frontier);
        assertEquals(popped.id(), recovered.id());
        assertEquals(Priority.NORMAL, recovered.priority());
        assertEquals(1, recovered.retryCount());

        assertTrue(frontier.complete(recovered.id()));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testRecoverStalledMovesExhaustedItemsToFailed(Backend backend) {
        var frontier = open(backend);
        frontier.push(CrawlItem.ofUrl("https://example.org/", "web").withMaxRetries(1));
        CrawlItem popped = popRequired(frontier);
        clock.advance(Duration.ofHours(1));

        assertEquals(0, frontier.recoverStalled(Duration.ofMinutes(30)), "failed items are not requeued");
        assertEquals(ItemState.FAILED, frontier.find(popped.id()).orElseThrow().state());
        assertEquals(0, frontier.stats().processingItems());
        assertFalse(frontier.fail(popped.id()));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testRecoverStalledCountsOnlyRequeuedItems(Backend backend) {
        var frontier = open(backend);
        frontier.push(url("https://example.org/retry", Priority.HIGH, T0));
        frontier.push(url("https://example.org/last-chance", Priority.LOW, T0).withMaxRetries(1));
        CrawlItem retried = popRequired(frontier);
        CrawlItem exhausted = popRequired(frontier);
        clock.advance(Duration.ofHours(1));

        assertEquals(1, frontier.recoverStalled(Duration.ofMinutes(30)));
        assertEquals(ItemState.PENDING, frontier.find(retried.id()).orElseThrow().state());
        assertEquals(ItemState.FAILED, frontier.find(exhausted.id()).orElseThrow().state());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testFailedItemsRejectsNegativeLimit(Backend backend) {
        var frontier = open(backend);
        assertThrows(IllegalArgumentException.class, () -> frontier.failedItems(-1));
        assertEquals(List.of(), frontier.failedItems(0));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testStallAgeCountsFromLease(Backend backend) {
        var frontier = open(backend);
        frontier.push(url("https://example.org/old", Priority.NORMAL, T0.minus(Duration.ofDays(2))));
        clock.advance(Duration.ofDays(1));
        CrawlItem popped = popRequired(frontier);

        assertEquals(0, frontier.recoverStalled(Duration.ofHours(1)));
        assertEquals(ItemState.PROCESSING, frontier.find(popped.id()).orElseThrow().state());
        assertThrows(IllegalArgumentException.class, () -> frontier.recoverStalled(Duration.ofSeconds(-1)));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testRoundTrip(Backend backend) {
        var frontier = open(backend);
        UUID subject = UUID.randomUUID();
        UUID parent = UUID.randomUUID();
        CrawlItem item = CrawlItem.ofQuery(Map.of("name", "Ada Lovelace", "born", 1815), "people")
                .withContext(subject, "mathematician", parent)
                .withScheduledAt(T0.plusSeconds(30));
        frontier.push(item);

        CrawlItem popped = popRequired(frontier);
        assertEquals(item.id(), popped.id());
        assertEquals(item.target(), popped.target());
        assertEquals("people", popped.adapterId());
        assertEquals(subject, popped.subjectId());
        assertEquals("mathematician", popped.hypothesis());
        assertEquals(parent, popped.parentItemId());
        assertEquals(item.scheduledAt(), popped.scheduledAt());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testStateSurvivesRestart(Backend backend) {
        var frontier = open(backend);
        CrawlItem normal = url("https://example.org/normal", Priority.NORMAL, T0);
        CrawlItem high = url("https://example.org/high", Priority.HIGH, T0.plusSeconds(1));
        CrawlItem low = url("https://example.org/low", Priority.LOW, T0.minusSeconds(1));
        CrawlItem critical = url("https://example.org/critical", Priority.CRITICAL, T0);
        frontier.pushMany(List.of(normal, high, low, critical));
        assertEquals(critical.id(), popRequired(frontier).id());
        frontier.close();
        this.frontier = null;

        var reopened = open(backend);
        assertEquals(3, reopened.size());
        assertEquals(ItemState.PROCESSING, reopened.find(critical.id()).orElseThrow().state());
        assertFalse(reopened.push(CrawlItem.ofUrl("https://example.org/low", "web")));
        assertTrue(reopened.complete(critical.id()));
        assertEquals(high.id(), popRequired(reopened).id());
        assertEquals(normal.id(), popRequired(reopened).id());
        assertEquals(low.id(), popRequired(reopened).id());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testPeekChangesNothing(Backend backend) {
        var frontier = open(backend);
        CrawlItem first = url("https://example.org/1", Priority.HIGH, T0);
        CrawlItem second = url("https://example.org/2", Priority.NORMAL, T0);
        frontier.pushMany(List.of(second, first));

        assertEquals(List.of(first.id()), frontier.peek(1).stream().map(CrawlItem::id).toList());
        assertEquals(List.of(first.id(), second.id()), frontier.peek(10).stream().map(CrawlItem::id).toList());
        assertEquals(2, frontier.size());
        assertEquals(first.id(), popRequired(frontier).id());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testStats(Backend backend) {
        var frontier = open(backend);
        frontier.pushMany(List.of(
                url("https://example.org/1", Priority.HIGH, T0),
                url("https://example.org/2", Priority.NORMAL, T0),
                CrawlItem.ofQuery(Map.of("q", "x"), "search").withCreatedAt(T0.plusSeconds(1)),
                CrawlItem.ofUrl("https://example.org/3", "").withCreatedAt(T0.plusSeconds(2))));
        assertEquals(Priority.HIGH, popRequired(frontier).priority());
        frontier.push(url("https://example.org/4", Priority.LOW, T0));
        frontier.complete(popRequired(frontier).id());

        FrontierStats stats = frontier.stats();
        assertEquals(5, stats.totalItems());
        assertEquals(3, stats.pendingItems());
        assertEquals(1, stats.processingItems());
        assertEquals(1, stats.completedItems());
        assertEquals(0, stats.failedItems());
        assertEquals(5, stats.uniqueFingerprints());
        assertEquals(Map.of(Priority.NORMAL, 2L, Priority.LOW, 1L), stats.pendingByPriority());
        assertEquals(Map.of("web", 1L, "search", 1L, "unknown", 1L), stats.pendingByAdapter());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testPopRepairsOrphanedEntries(Backend backend) {
        var codec = new ItemCodec();
        StateStore store = StateStores.open(dir, backend, new ItemSnapshotFormat(codec));
        frontier = new FrontierQueue(store, codec, clock);
        CrawlItem real = url("https://example.org/real", Priority.NORMAL, T0);
        frontier.push(real);
        UUID orphan = UUID.randomUUID();
        store.put(QueueKeys.encode(Priority.CRITICAL, T0, orphan), QueueKeys.idValue(orphan));
        assertEquals(2, store.count(QueueKeys.prefix()));

        assertEquals(List.of(real.id()), frontier.peek(5).stream().map(CrawlItem::id).toList());
        assertEquals(real.id(), popRequired(frontier).id());
        assertEquals(0, store.count(QueueKeys.prefix()));
        assertTrue(frontier.pop().isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testConcurrentPopHandsOutEachItemOnce(Backend backend) throws Exception {
        var frontier = open(backend);
        int itemCount = 200;
        var items = new ArrayList<CrawlItem>();
        for (int i = 0; i < itemCount; i++) {
            items.add(CrawlItem.ofUrl("https://example.org/" + i, "web"));
        }
        assertEquals(itemCount, frontier.pushMany(items));

        int threads = 8;
        Set<UUID> popped = ConcurrentHashMap.newKeySet();
        var pops = new AtomicInteger();
        var start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    while (true) {
                        var item = frontier.pop();
                        if (item.isEmpty()) return null;
                        pops.incrementAndGet();
                        popped.add(item.get().id());
                    }
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(itemCount, pops.get());
        assertEquals(itemCount, popped.size());
        assertEquals(itemCount, frontier.stats().processingItems());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testClear(Backend backend) {
        var frontier = open(backend);
        CrawlItem item = CrawlItem.ofUrl("https://example.org/", "web");
        frontier.push(item);
        frontier.clear();

        assertTrue(frontier.isEmpty());
        assertFalse(frontier.isDuplicate(item));
        assertTrue(frontier.find(item.id()).isEmpty());
        assertTrue(frontier.push(CrawlItem.ofUrl("https://example.org/", "web")));
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"EMBEDDED", "FILE"})
    void testSecondOpenFailsFast(Backend backend) {
        open(backend);
        assertThrows(StoreLockedException.class, () -> FrontierQueue.open(dir, backend, clock));
    }
}
