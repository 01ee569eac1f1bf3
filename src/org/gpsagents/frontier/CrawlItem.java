package org.gpsagents.frontier;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.NoArgGenerator;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of crawl work: fetch a URL or run a query against a source adapter.
 *
 * <p>Items are immutable. The frontier produces updated copies when it bumps the retry count or demotes the
 * priority of a failed item; the id and target never change.</p>
 *
 * @param id           unique id, time-ordered for newly created items
 * @param target       the URL or query to fetch
 * @param adapterId    the source adapter that processes this item
 * @param priority     processing tier
 * @param subjectId    the subject being researched, if any
 * @param hypothesis   why this item was enqueued, if known
 * @param parentItemId the item whose processing discovered this one
 * @param createdAt    creation time, orders items within a tier
 * @param scheduledAt  earliest processing time (recorded but not enforced)
 * @param retryCount   failed attempts so far
 * @param maxRetries   attempts allowed before the item is moved to failed
 */
public record CrawlItem(
        UUID id,
        CrawlTarget target,
        String adapterId,
        Priority priority,
        @Nullable UUID subjectId,
        @Nullable String hypothesis,
        @Nullable UUID parentItemId,
        Instant createdAt,
        @Nullable Instant scheduledAt,
        int retryCount,
        int maxRetries) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    private static final NoArgGenerator idGenerator = Generators.timeBasedEpochGenerator();

    public CrawlItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(createdAt, "createdAt");
        if (adapterId == null) adapterId = "";
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must not be negative");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must not be negative");
    }

    public static CrawlItem of(CrawlTarget target, String adapterId) {
        return new CrawlItem(idGenerator.generate(), target, adapterId, Priority.NORMAL, null, null, null,
                Instant.now(), null, 0, DEFAULT_MAX_RETRIES);
    }

    public static CrawlItem ofUrl(String url, String adapterId) {
        return of(new CrawlTarget.Url(url), adapterId);
    }

    public static CrawlItem ofQuery(Map<String, Object> query, String adapterId) {
        return of(new CrawlTarget.Query(query), adapterId);
    }

    public @Nullable String url() {
        return target instanceof CrawlTarget.Url url ? url.url() : null;
    }

    public Map<String, Object> query() {
        return target instanceof CrawlTarget.Query query ? query.query() : Map.of();
    }

    /**
     * Deduplication key derived from the target and adapter only.
     */
    public String fingerprint() {
        return Fingerprints.of(target, adapterId);
    }

    public CrawlItem withPriority(Priority priority) {
        return new CrawlItem(id, target, adapterId, priority, subjectId, hypothesis, parentItemId, createdAt,
                scheduledAt, retryCount, maxRetries);
    }

    public CrawlItem withContext(@Nullable UUID subjectId, @Nullable String hypothesis, @Nullable UUID parentItemId) {
        return new CrawlItem(id, target, adapterId, priority, subjectId, hypothesis, parentItemId, createdAt,
                scheduledAt, retryCount, maxRetries);
    }

    public CrawlItem withCreatedAt(Instant createdAt) {
        return new CrawlItem(id, target, adapterId, priority, subjectId, hypothesis, parentItemId, createdAt,
                scheduledAt, retryCount, maxRetries);
    }

    public CrawlItem withScheduledAt(@Nullable Instant scheduledAt) {
        return new CrawlItem(id, target, adapterId, priority, subjectId, hypothesis, parentItemId, createdAt,
                scheduledAt, retryCount, maxRetries);
    }

    public CrawlItem withMaxRetries(int maxRetries) {
        return new CrawlItem(id, target, adapterId, priority, subjectId, hypothesis, parentItemId, createdAt,
                scheduledAt, retryCount, maxRetries);
    }

    CrawlItem withRetryCount(int retryCount) {
        if (retryCount < this.retryCount) throw new IllegalArgumentException("retryCount cannot decrease");
        return new CrawlItem(id, target, adapterId, priority, subjectId, hypothesis, parentItemId, createdAt,
                scheduledAt, retryCount, maxRetries);
    }
}
