package com.traffic.counts.pivot;

import java.io.Serializable;

/**
 * Average speed of one day pivoted into hour columns. An hour without
 * vehicles is null.
 */
public class NonNormalAvgSpeedCount implements Serializable {

    private static final long serialVersionUID = 1L;

    public final NonNormalCountKey key;

    private final Double[] hours = new Double[HourColumns.HOURS];

    public NonNormalAvgSpeedCount(NonNormalCountKey key) {
        this.key = key;
    }

    void set(int hour, Double average) {
        hours[hour] = average;
    }

    public Double hour(int hour) {
        return hours[hour];
    }
}
