package com.traffic.counts.common;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Fifteen-minute bicycle or pedestrian total. In/out counts are only present
 * for bidirectional counts.
 */
public class BikePedCount implements Serializable {

    private static final long serialVersionUID = 1L;

    public int recordNum;
    public LocalDate date;
    public LocalTime time;
    public int total;
    public Integer inCount;
    public Integer outCount;

    public BikePedCount() {
    }

    public BikePedCount(int recordNum, LocalDate date, LocalTime time, int total, Integer inCount, Integer outCount) {
        this.recordNum = recordNum;
        this.date = date;
        this.time = time;
        this.total = total;
        this.inCount = inCount;
        this.outCount = outCount;
    }

    public LocalDateTime dateTime() {
        return LocalDateTime.of(date, time);
    }
}
