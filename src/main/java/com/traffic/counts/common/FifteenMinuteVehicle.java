package com.traffic.counts.common;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Pre-binned fifteen-minute volume of one channel.
 */
public class FifteenMinuteVehicle implements Serializable {

    private static final long serialVersionUID = 1L;

    public int recordNum;
    public LocalDate date;
    public LocalTime time;
    public int count;
    public Direction direction;
    public int channel;

    public FifteenMinuteVehicle() {
    }

    public FifteenMinuteVehicle(int recordNum, LocalDate date, LocalTime time, int count, Direction direction, int channel) {
        this.recordNum = recordNum;
        this.date = date;
        this.time = time;
        this.count = count;
        this.direction = direction;
        this.channel = channel;
    }

    public LocalDateTime dateTime() {
        return LocalDateTime.of(date, time);
    }
}
