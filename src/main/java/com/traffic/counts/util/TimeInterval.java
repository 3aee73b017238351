package com.traffic.counts.util;

/**
 * Width of a time bin.
 */
public enum TimeInterval {
    FIFTEEN_MIN(15),
    HOURLY(60);

    private final int minutes;

    TimeInterval(int minutes) {
        this.minutes = minutes;
    }

    public int minutes() {
        return minutes;
    }
}
