package com.firesql.domain;

import java.time.Instant;

/**
 * Dashboard time window. A bound equal to the epoch (or absent) counts as unset.
 */
public class TimeWindow {

    public static final TimeWindow NONE = new TimeWindow(null, null);

    private final Instant from;
    private final Instant to;

    public TimeWindow(Instant from, Instant to) {
        this.from = from;
        this.to = to;
    }

    /**
     * Build a window from epoch milliseconds, 0 meaning unset.
     */
    public static TimeWindow ofEpochMillis(long from, long to) {
        return new TimeWindow(
            from != 0 ? Instant.ofEpochMilli(from) : null,
            to != 0 ? Instant.ofEpochMilli(to) : null);
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    /**
     * True only when both bounds are set and non-zero.
     */
    public boolean hasBounds() {
        return isSet(from) && isSet(to);
    }

    private static boolean isSet(Instant bound) {
        return bound != null && !Instant.EPOCH.equals(bound);
    }

    @Override
    public String toString() {
        return "TimeWindow[" + from + ", " + to + "]";
    }
}
