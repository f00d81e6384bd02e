package com.rainfall.cleansing.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * 时间范围 [start, end)
 */
public class TimeRange implements Serializable {
    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public Instant getStart() { return start; }
    public Instant getEnd() { return end; }

    @Override
    public String toString() {
        return "[" + start + " -> " + end + ")";
    }
}
