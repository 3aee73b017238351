package com.traffic.counts.count;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.traffic.counts.common.CountMetadata;
import com.traffic.counts.common.Direction;
import com.traffic.counts.common.IndividualVehicle;
import com.traffic.counts.util.TimeBins;
import com.traffic.counts.util.TimeInterval;

/**
 * Bins individual vehicles into per-channel speed and class histograms.
 */
public final class BinnedCountBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(BinnedCountBuilder.class);

    private BinnedCountBuilder() {
    }

    /**
     * Accumulate vehicles into bins, add zero rows for bins without vehicles,
     * and drop the first and last bin of every channel as partial periods.
     */
    public static BinnedCounts build(CountMetadata metadata, List<IndividualVehicle> vehicles, TimeInterval interval) {
        Map<BinnedCountKey, SpeedRangeCount> speeds = new HashMap<>();
        Map<BinnedCountKey, VehicleClassCount> classes = new HashMap<>();
        LocalDateTime first = null;
        LocalDateTime last = null;

        for (IndividualVehicle v : vehicles) {
            Direction direction = metadata.directions.forChannel(v.channel);
            if (direction == null) {
                LOG.error("{}: vehicle on channel {} at {} has no direction, skipped",
                        metadata.recordNum, v.channel, v.dateTime());
                continue;
            }
            LocalDateTime dt = v.dateTime();
            if (first == null || dt.isBefore(first)) {
                first = dt;
            }
            if (last == null || dt.isAfter(last)) {
                last = dt;
            }
            BinnedCountKey key = new BinnedCountKey(TimeBins.binDateTime(dt, interval), v.channel);
            speeds.computeIfAbsent(key, k -> new SpeedRangeCount(metadata.recordNum, k.dateTime, k.channel, direction))
                    .insert(v.speed);
            classes.computeIfAbsent(key, k -> new VehicleClassCount(metadata.recordNum, k.dateTime, k.channel, direction))
                    .insert(v.vehicleClass);
        }

        if (first == null) {
            return BinnedCounts.empty();
        }

        List<Integer> channels = metadata.directions.channels();
        for (LocalDateTime bin : TimeBins.createTimeBins(first, last, interval)) {
            for (int channel : channels) {
                Direction direction = metadata.directions.forChannel(channel);
                BinnedCountKey key = new BinnedCountKey(bin, channel);
                speeds.putIfAbsent(key, new SpeedRangeCount(metadata.recordNum, bin, channel, direction));
                classes.putIfAbsent(key, new VehicleClassCount(metadata.recordNum, bin, channel, direction));
            }
        }

        int edge = channels.size();
        return new BinnedCounts(trimEdges(speeds, edge), trimEdges(classes, edge));
    }

    private static <T> List<T> trimEdges(Map<BinnedCountKey, T> rows, int edge) {
        List<T> sorted = new ArrayList<>(new TreeMap<>(rows).values());
        if (sorted.size() <= 2 * edge) {
            return new ArrayList<>();
        }
        return new ArrayList<>(sorted.subList(edge, sorted.size() - edge));
    }
}
