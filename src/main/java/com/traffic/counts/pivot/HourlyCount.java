package com.traffic.counts.pivot;

import java.io.Serializable;
import java.time.LocalDateTime;

import com.traffic.counts.common.Direction;

/**
 * Volume summed to the hour, as read back from a binned count table.
 */
public class HourlyCount implements Serializable {

    private static final long serialVersionUID = 1L;

    public int recordNum;
    public LocalDateTime hour;
    public int count;
    public Direction direction;
    public Integer lane;

    public HourlyCount() {
    }

    public HourlyCount(int recordNum, LocalDateTime hour, int count, Direction direction, Integer lane) {
        this.recordNum = recordNum;
        this.hour = hour;
        this.count = count;
        this.direction = direction;
        this.lane = lane;
    }
}
