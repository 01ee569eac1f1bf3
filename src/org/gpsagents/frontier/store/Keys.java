package org.gpsagents.frontier.store;

import java.util.Arrays;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Helpers for comparing and ranging over binary keys. Keys sort as unsigned bytes, the same order SQLite uses for
 * BLOBs.
 */
public final class Keys {
    private Keys() {
    }

    public static int compare(byte[] a, byte[] b) {
        return Arrays.compareUnsigned(a, b);
    }

    public static boolean startsWith(byte[] key, byte[] prefix) {
        return key.length >= prefix.length && Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    /**
     * The smallest key greater than every key starting with {@code prefix}.
     */
    public static byte[] prefixEnd(byte[] prefix) {
        byte[] end = Arrays.copyOf(prefix, prefix.length);
        for (int i = end.length - 1; i >= 0; i--) {
            if (end[i] != (byte) 0xff) {
                end[i]++;
                return Arrays.copyOf(end, i + 1);
            }
        }
        throw new IllegalArgumentException("Prefix has no upper bound");
    }

    public static <V> NavigableMap<byte[], V> newSortedMap() {
        return new TreeMap<>(Keys::compare);
    }
}
