package org.gpsagents.frontier;

import java.util.Locale;

public enum ItemState {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    /**
     * Lower-case name used as the status tag of snapshot records.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ItemState fromTag(String tag) {
        return valueOf(tag.toUpperCase(Locale.ROOT));
    }
}
