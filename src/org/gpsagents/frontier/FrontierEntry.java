package org.gpsagents.frontier;

/**
 * An item together with the partition it currently sits in.
 */
public record FrontierEntry(CrawlItem item, ItemState state) {
}
