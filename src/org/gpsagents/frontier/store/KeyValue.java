package org.gpsagents.frontier.store;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A key and its value as returned by an ordered scan.
 */
public record KeyValue(byte[] key, byte[] value) {
    public String keyString() {
        return new String(key, UTF_8);
    }

    @Override
    public String toString() {
        return keyString();
    }
}
