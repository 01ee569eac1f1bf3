package org.gpsagents.frontier;

import java.time.Instant;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Key layout of the frontier inside the state store.
 *
 * <pre>
 * q:{priority:3}:{createdAt micros:16}:{id}   pending queue entry, value is the item id
 * proc:{id}                                  lease of a popped item
 * done:{id}                                  completed marker
 * fail:{id}                                  failed marker
 * item:{id}                                  item body
 * seen:{fingerprint}                         dedup marker
 * </pre>
 *
 * Numeric fields are zero-padded to a fixed width so that byte order of pending keys is priority order, then age,
 * then id.
 */
public final class QueueKeys {
    public static final String PENDING = "q:";
    public static final String PROCESSING = "proc:";
    public static final String COMPLETED = "done:";
    public static final String FAILED = "fail:";
    public static final String ITEM = "item:";
    public static final String SEEN = "seen:";

    static final int PRIORITY_WIDTH = 3;
    static final int TIMESTAMP_WIDTH = 16;

    private static final byte[] PENDING_PREFIX = PENDING.getBytes(US_ASCII);

    private QueueKeys() {
    }

    public static byte[] prefix() {
        return PENDING_PREFIX.clone();
    }

    public static byte[] encode(CrawlItem item) {
        return encode(item.priority(), item.createdAt(), item.id());
    }

    public static byte[] encode(Priority priority, Instant createdAt, UUID id) {
        String key = PENDING + pad(priority.value(), PRIORITY_WIDTH) + ":"
                     + pad(epochMicros(createdAt), TIMESTAMP_WIDTH) + ":" + id;
        return key.getBytes(US_ASCII);
    }

    static String pad(long value, int width) {
        if (value < 0) throw new IllegalArgumentException("Negative key component: " + value);
        String digits = Long.toString(value);
        if (digits.length() > width) {
            throw new IllegalArgumentException(value + " does not fit in " + width + " digits");
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    static long epochMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1000);
    }

    public static byte[] processing(UUID id) {
        return (PROCESSING + id).getBytes(US_ASCII);
    }

    public static byte[] completed(UUID id) {
        return (COMPLETED + id).getBytes(US_ASCII);
    }

    public static byte[] failed(UUID id) {
        return (FAILED + id).getBytes(US_ASCII);
    }

    public static byte[] item(UUID id) {
        return (ITEM + id).getBytes(US_ASCII);
    }

    public static byte[] seen(String fingerprint) {
        return (SEEN + fingerprint).getBytes(US_ASCII);
    }

    /**
     * Value stored under seen keys.
     */
    public static byte[] seenMarker() {
        return new byte[]{'1'};
    }

    public static byte[] region(String prefix) {
        return prefix.getBytes(US_ASCII);
    }

    public static byte[] idValue(UUID id) {
        return id.toString().getBytes(US_ASCII);
    }

    public static UUID parseIdValue(byte[] value) {
        return UUID.fromString(new String(value, US_ASCII));
    }

    /**
     * Extracts the id from a key of the form {@code prefix + id}.
     */
    public static UUID idFromKey(String prefix, byte[] key) {
        String text = new String(key, US_ASCII);
        if (!text.startsWith(prefix)) throw new IllegalArgumentException("Key " + text + " is not in " + prefix);
        return UUID.fromString(text.substring(prefix.length()));
    }
}
