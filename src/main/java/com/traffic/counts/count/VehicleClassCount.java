package com.traffic.counts.count;

import java.io.Serializable;
import java.time.LocalDateTime;

import com.traffic.counts.common.Direction;
import com.traffic.counts.common.VehicleClass;

/**
 * Vehicle class histogram of one bin and channel.
 * <p>
 * Unclassified vehicles are counted in their own bucket and again as
 * passenger cars, while {@code total} is only incremented once. Reports built
 * on these tables rely on that convention.
 */
public class VehicleClassCount implements Serializable {

    private static final long serialVersionUID = 1L;

    public int recordNum;
    public LocalDateTime dateTime;
    public int channel;
    public Direction direction;
    public int total;

    // indexed by class number, 14 is never used
    private final int[] counts = new int[16];

    public VehicleClassCount() {
    }

    public VehicleClassCount(int recordNum, LocalDateTime dateTime, int channel, Direction direction) {
        this.recordNum = recordNum;
        this.dateTime = dateTime;
        this.channel = channel;
        this.direction = direction;
    }

    public void insert(VehicleClass vehicleClass) {
        counts[vehicleClass.num()]++;
        if (vehicleClass == VehicleClass.UNCLASSIFIED) {
            counts[VehicleClass.PASSENGER_CARS.num()]++;
        }
        total++;
    }

    public int get(VehicleClass vehicleClass) {
        return counts[vehicleClass.num()];
    }
}
