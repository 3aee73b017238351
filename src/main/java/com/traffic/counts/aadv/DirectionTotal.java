package com.traffic.counts.aadv;

import java.time.LocalDate;

/**
 * Daily sum of a table with one row per direction. {@code direction} is the
 * raw column value and is null for counts stored without one.
 */
public class DirectionTotal {

    public LocalDate date;
    public long total;
    public String direction;

    public DirectionTotal() {
    }

    public DirectionTotal(LocalDate date, long total, String direction) {
        this.date = date;
        this.total = total;
        this.direction = direction;
    }
}
