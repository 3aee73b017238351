package com.traffic.counts.aadv;

import java.time.LocalDate;

/**
 * Daily sums of a table with in and out columns.
 */
public class InOutTotal {

    public LocalDate date;
    public long total;
    public long in;
    public long out;

    public InOutTotal() {
    }

    public InOutTotal(LocalDate date, long total, long in, long out) {
        this.date = date;
        this.total = total;
        this.in = in;
        this.out = out;
    }
}
