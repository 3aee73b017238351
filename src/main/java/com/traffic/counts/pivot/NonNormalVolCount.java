package com.traffic.counts.pivot;

import java.io.Serializable;

/**
 * Volume of one day pivoted into hour columns. An hour without data is null,
 * not zero.
 */
public class NonNormalVolCount implements Serializable {

    private static final long serialVersionUID = 1L;

    public final NonNormalCountKey key;
    public Integer setFlag;
    public Integer totalCount;

    private final Integer[] hours = new Integer[HourColumns.HOURS];

    public NonNormalVolCount(NonNormalCountKey key) {
        this.key = key;
    }

    public void add(int hour, int count) {
        totalCount = totalCount == null ? count : totalCount + count;
        hours[hour] = hours[hour] == null ? count : hours[hour] + count;
    }

    public Integer hour(int hour) {
        return hours[hour];
    }
}
