package org.gpsagents.frontier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content fingerprints used for deduplication.
 *
 * <p>The fingerprint covers the url, query and adapter id only. They are rendered as JSON with every object's keys
 * sorted (nested query maps included) and hashed with SHA-256, so neither field order nor priority, context or
 * timestamps affect the result.</p>
 */
public final class Fingerprints {
    private static final int LENGTH_BYTES = 16;
    private static final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private Fingerprints() {
    }

    public static String of(CrawlItem item) {
        return of(item.target(), item.adapterId());
    }

    public static String of(CrawlTarget target, String adapterId) {
        var canonical = new TreeMap<String, Object>();
        canonical.put("adapter_id", adapterId == null ? "" : adapterId);
        canonical.put("query", target instanceof CrawlTarget.Query query ? query.query() : Map.of());
        canonical.put("url", target instanceof CrawlTarget.Url url ? url.url() : null);
        try {
            byte[] json = canonicalMapper.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest, 0, LENGTH_BYTES);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query is not serializable: " + target, e);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }
}
