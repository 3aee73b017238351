package com.traffic.counts.count;

import java.util.Collections;
import java.util.List;

/**
 * Speed and class histograms derived from the same set of vehicles, both
 * ordered by bin start and channel.
 */
public class BinnedCounts {

    public final List<SpeedRangeCount> speedRangeCounts;
    public final List<VehicleClassCount> vehicleClassCounts;

    public BinnedCounts(List<SpeedRangeCount> speedRangeCounts, List<VehicleClassCount> vehicleClassCounts) {
        this.speedRangeCounts = Collections.unmodifiableList(speedRangeCounts);
        this.vehicleClassCounts = Collections.unmodifiableList(vehicleClassCounts);
    }

    public static BinnedCounts empty() {
        return new BinnedCounts(Collections.emptyList(), Collections.emptyList());
    }
}
