package org.gpsagents.frontier;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.gpsagents.frontier.store.StateStoreException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * JSON form of crawl items and of the small records kept next to them.
 *
 * <p>Item fields use the names {@code item_id, url, query, adapter_id, priority, subject_id, hypothesis,
 * parent_item_id, created_at, scheduled_at, retry_count, max_retries}. The same form is used for item bodies in
 * the store and for snapshot lines.</p>
 */
public class ItemCodec {
    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public byte[] encode(CrawlItem item) {
        try {
            return mapper.writeValueAsBytes(StoredItem.from(item));
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to serialize item " + item.id(), e);
        }
    }

    public CrawlItem decode(byte[] json) {
        try {
            return mapper.readValue(json, StoredItem.class).toItem();
        } catch (IOException | IllegalArgumentException e) {
            throw new StateStoreException("Corrupt item record", e);
        }
    }

    public ObjectNode toTree(CrawlItem item) {
        return mapper.valueToTree(StoredItem.from(item));
    }

    /**
     * @throws IllegalArgumentException if the node is not a valid item
     */
    public CrawlItem fromTree(JsonNode node) {
        try {
            return mapper.treeToValue(node, StoredItem.class).toItem();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid item record: " + e.getMessage(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public byte[] encodeLease(Instant leasedAt) {
        return writeBytes(new Lease(leasedAt));
    }

    public Instant decodeLease(byte[] json) {
        return readBytes(json, Lease.class).leasedAt();
    }

    public byte[] encodeOutcome(Instant finishedAt) {
        return writeBytes(new Outcome(finishedAt));
    }

    public Instant decodeOutcome(byte[] json) {
        return readBytes(json, Outcome.class).finishedAt();
    }

    private byte[] writeBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private <T> T readBytes(byte[] json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new StateStoreException("Corrupt " + type.getSimpleName().toLowerCase(Locale.ROOT) + " record", e);
        }
    }

    /**
     * Processing record written when an item is popped.
     */
    record Lease(@JsonProperty("leased_at") Instant leasedAt) {
    }

    /**
     * Marker written when an item reaches completed or failed.
     */
    record Outcome(@JsonProperty("finished_at") Instant finishedAt) {
    }

    record StoredItem(
            @JsonProperty("item_id") UUID itemId,
            @JsonProperty("url") @Nullable String url,
            @JsonProperty("query") @Nullable Map<String, Object> query,
            @JsonProperty("adapter_id") @Nullable String adapterId,
            @JsonProperty("priority") @Nullable Integer priority,
            @JsonProperty("subject_id") @Nullable UUID subjectId,
            @JsonProperty("hypothesis") @Nullable String hypothesis,
            @JsonProperty("parent_item_id") @Nullable UUID parentItemId,
            @JsonProperty("created_at") @Nullable Instant createdAt,
            @JsonProperty("scheduled_at") @Nullable Instant scheduledAt,
            @JsonProperty("retry_count") @Nullable Integer retryCount,
            @JsonProperty("max_retries") @Nullable Integer maxRetries) {

        static StoredItem from(CrawlItem item) {
            return new StoredItem(item.id(), item.url(), new LinkedHashMap<>(item.query()), item.adapterId(),
                    item.priority().value(), item.subjectId(), item.hypothesis(), item.parentItemId(),
                    item.createdAt(), item.scheduledAt(), item.retryCount(), item.maxRetries());
        }

        CrawlItem toItem() {
            if (itemId == null) throw new IllegalArgumentException("item_id is required");
            boolean hasQuery = query != null && !query.isEmpty();
            CrawlTarget target;
            if (url != null && hasQuery) {
                throw new IllegalArgumentException("Item " + itemId + " has both a url and a query");
            } else if (url != null) {
                target = new CrawlTarget.Url(url);
            } else if (hasQuery) {
                target = new CrawlTarget.Query(query);
            } else {
                throw new IllegalArgumentException("Item " + itemId + " has neither a url nor a query");
            }
            return new CrawlItem(itemId, target, adapterId == null ? "" : adapterId,
                    priority == null ? Priority.NORMAL : Priority.fromValue(priority),
                    subjectId, hypothesis, parentItemId,
                    createdAt == null ? Instant.now() : createdAt, scheduledAt,
                    retryCount == null ? 0 : retryCount,
                    maxRetries == null ? CrawlItem.DEFAULT_MAX_RETRIES : maxRetries);
        }
    }
}
