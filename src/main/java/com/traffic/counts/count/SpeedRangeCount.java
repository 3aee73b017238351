package com.traffic.counts.count;

import java.io.Serializable;
import java.time.LocalDateTime;

import com.traffic.counts.common.Direction;

/**
 * Speed histogram of one bin and channel, in 14 bands of 5 mph:
 * s1 holds everything up to 15.0 (negative speeds included), s2 15.0-20.0, ...,
 * s13 70.0-75.0 and s14 anything faster. Upper bounds are inclusive.
 */
public class SpeedRangeCount implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int BANDS = 14;

    public int recordNum;
    public LocalDateTime dateTime;
    public int channel;
    public Direction direction;
    public int total;

    private final int[] bands = new int[BANDS];

    public SpeedRangeCount() {
    }

    public SpeedRangeCount(int recordNum, LocalDateTime dateTime, int channel, Direction direction) {
        this.recordNum = recordNum;
        this.dateTime = dateTime;
        this.channel = channel;
        this.direction = direction;
    }

    public void insert(double speed) {
        bands[bandFor(speed) - 1]++;
        total++;
    }

    /**
     * @param band 1-based band number
     */
    public int band(int band) {
        if (band < 1 || band > BANDS) {
            throw new IllegalArgumentException("Speed band out of range: " + band);
        }
        return bands[band - 1];
    }

    /**
     * 1-based band a speed falls into.
     */
    public static int bandFor(double speed) {
        if (Double.isNaN(speed) || speed <= 15.0) {
            return 1;
        }
        if (speed > 75.0) {
            return BANDS;
        }
        // (15, 20] -> 2 ... (70, 75] -> 13
        return (int) Math.ceil((speed - 15.0) / 5.0) + 1;
    }
}
