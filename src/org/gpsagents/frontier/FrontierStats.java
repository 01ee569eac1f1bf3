package org.gpsagents.frontier;

import java.util.Map;

/**
 * Point-in-time counts of the frontier, computed by scanning the store.
 *
 * @param totalItems         items in any state
 * @param pendingItems       queue entries waiting to be popped
 * @param processingItems    items currently leased to a worker
 * @param completedItems     items completed successfully
 * @param failedItems        items that exhausted their retries or were failed without requeue
 * @param uniqueFingerprints distinct targets ever enqueued
 * @param pendingByPriority  pending items per priority tier
 * @param pendingByAdapter   pending items per adapter id ("unknown" when blank)
 */
public record FrontierStats(
        long totalItems,
        long pendingItems,
        long processingItems,
        long completedItems,
        long failedItems,
        long uniqueFingerprints,
        Map<Priority, Long> pendingByPriority,
        Map<String, Long> pendingByAdapter) {
}
