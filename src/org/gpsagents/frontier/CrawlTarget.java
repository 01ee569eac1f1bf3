package org.gpsagents.frontier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a crawl item fetches: either a URL or a structured query for the item's adapter.
 */
public sealed interface CrawlTarget permits CrawlTarget.Url, CrawlTarget.Query {

    record Url(String url) implements CrawlTarget {
        public Url {
            Objects.requireNonNull(url, "url");
            if (url.isBlank()) throw new IllegalArgumentException("url must not be blank");
        }

        @Override
        public String toString() {
            return url;
        }
    }

    record Query(Map<String, Object> query) implements CrawlTarget {
        public Query {
            Objects.requireNonNull(query, "query");
            if (query.isEmpty()) throw new IllegalArgumentException("query must not be empty");
            query = copyMap(query);
        }

        private static Map<String, Object> copyMap(Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
            return Collections.unmodifiableMap(copy);
        }

        // nested maps and lists are copied as well
        private static Object copyValue(Object value) {
            if (value instanceof Map<?, ?> map) return copyMap(map);
            if (value instanceof List<?> list) {
                var copy = new ArrayList<Object>(list.size());
                for (Object element : list) copy.add(copyValue(element));
                return Collections.unmodifiableList(copy);
            }
            return value;
        }

        @Override
        public String toString() {
            return query.toString();
        }
    }
}
