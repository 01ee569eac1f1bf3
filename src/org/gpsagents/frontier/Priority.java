package org.gpsagents.frontier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processing tiers for crawl items. Lower values are processed first.
 */
public enum Priority {
    CRITICAL(0),
    HIGH(10),
    NORMAL(50),
    LOW(80),
    BACKGROUND(100);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    @JsonValue
    public int value() {
        return value;
    }

    /**
     * The next tier towards BACKGROUND. BACKGROUND demotes to itself.
     */
    public Priority demote() {
        return this == BACKGROUND ? BACKGROUND : values()[ordinal() + 1];
    }

    @JsonCreator
    public static Priority fromValue(int value) {
        for (Priority priority : values()) {
            if (priority.value == value) return priority;
        }
        throw new IllegalArgumentException("Unknown priority value: " + value);
    }
}
