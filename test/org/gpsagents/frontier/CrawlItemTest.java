package org.gpsagents.frontier;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CrawlItemTest {
    @Test
    void targetIsEitherUrlOrQuery() {
        CrawlItem url = CrawlItem.ofUrl("https://example.org/", "web");
        assertEquals("https://example.org/", url.url());
        assertEquals(Map.of(), url.query());

        CrawlItem query = CrawlItem.ofQuery(Map.of("q", "x"), "search");
        assertNull(query.url());
        assertEquals(Map.of("q", "x"), query.query());

        assertThrows(IllegalArgumentException.class, () -> CrawlItem.ofUrl(" ", "web"));
        assertThrows(IllegalArgumentException.class, () -> CrawlItem.ofQuery(Map.of(), "search"));
    }

    @Test
    void queryIsCopied() {
        var map = new HashMap<String, Object>();
        map.put("q", "x");
        CrawlItem item = CrawlItem.ofQuery(map, "search");
        map.put("q", "y");
        assertEquals("x", item.query().get("q"));
        assertThrows(UnsupportedOperationException.class, () -> item.query().put("z", 1));
    }

    @Test
    void nestedQueryValuesAreCopied() {
        var filters = new HashMap<String, Object>();
        filters.put("year", 2024);
        var terms = new ArrayList<Object>(List.of("a", "b"));
        var map = new HashMap<String, Object>();
        map.put("filters", filters);
        map.put("terms", terms);
        CrawlItem item = CrawlItem.ofQuery(map, "search");
        String fingerprint = item.fingerprint();

        filters.put("year", 1999);
        terms.add("c");

        assertEquals(Map.of("year", 2024), item.query().get("filters"));
        assertEquals(List.of("a", "b"), item.query().get("terms"));
        assertEquals(fingerprint, item.fingerprint());
        @SuppressWarnings("unchecked")
        var copiedFilters = (Map<String, Object>) item.query().get("filters");
        assertThrows(UnsupportedOperationException.class, () -> copiedFilters.put("year", 1));
    }

    @Test
    void newItemsHaveDefaults() {
        CrawlItem item = CrawlItem.ofUrl("https://example.org/", "web");
        assertEquals(Priority.NORMAL, item.priority());
        assertEquals(0, item.retryCount());
        assertEquals(3, item.maxRetries());
        assertEquals(7, item.id().version());
        assertNotEquals(item.id(), CrawlItem.ofUrl("https://example.org/", "web").id());
    }

    @Test
    void rejectsNegativeRetries() {
        CrawlItem item = CrawlItem.ofUrl("https://example.org/", "web");
        assertThrows(IllegalArgumentException.class, () -> item.withMaxRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> item.withRetryCount(2).withRetryCount(1));
    }
}
