package com.traffic.counts.pivot;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
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

/**
 * Folds vehicles or hourly sums into one row per record, date, direction and
 * lane with a column per hour of day. Rows come back ordered by key.
 */
public final class HourlyPivotBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(HourlyPivotBuilder.class);

    private HourlyPivotBuilder() {
    }

    /**
     * Hourly volumes from individual vehicles. The first and last hour of the
     * whole count are left out since they are rarely complete.
     */
    public static List<NonNormalVolCount> volumeFromVehicles(CountMetadata metadata, List<IndividualVehicle> vehicles) {
        Map<NonNormalCountKey, NonNormalVolCount> rows = new HashMap<>();
        EdgeHours edges = EdgeHours.of(vehicles);
        for (IndividualVehicle v : vehicles) {
            NonNormalCountKey key = keyFor(metadata, v, edges);
            if (key == null) {
                continue;
            }
            rows.computeIfAbsent(key, NonNormalVolCount::new).add(v.time.getHour(), 1);
        }
        return new ArrayList<>(new TreeMap<>(rows).values());
    }

    /**
     * Hourly average speeds from individual vehicles, with the same edge-hour
     * exclusion as {@link #volumeFromVehicles}.
     */
    public static List<NonNormalAvgSpeedCount> avgSpeedFromVehicles(CountMetadata metadata, List<IndividualVehicle> vehicles) {
        Map<NonNormalCountKey, List<List<Double>>> speeds = new HashMap<>();
        EdgeHours edges = EdgeHours.of(vehicles);
        for (IndividualVehicle v : vehicles) {
            NonNormalCountKey key = keyFor(metadata, v, edges);
            if (key == null) {
                continue;
            }
            List<List<Double>> byHour = speeds.computeIfAbsent(key, k -> emptyHours());
            byHour.get(v.time.getHour()).add(v.speed);
        }

        List<NonNormalAvgSpeedCount> out = new ArrayList<>(speeds.size());
        for (Map.Entry<NonNormalCountKey, List<List<Double>>> e : new TreeMap<>(speeds).entrySet()) {
            NonNormalAvgSpeedCount row = new NonNormalAvgSpeedCount(e.getKey());
            for (int hour = 0; hour < HourColumns.HOURS; hour++) {
                List<Double> values = e.getValue().get(hour);
                if (!values.isEmpty()) {
                    double sum = 0;
                    for (double s : values) {
                        sum += s;
                    }
                    row.set(hour, sum / values.size());
                }
            }
            out.add(row);
        }
        return out;
    }

    /**
     * Hourly volumes from sums already truncated to the hour, as read back from
     * a binned count table.
     */
    public static List<NonNormalVolCount> volumeFromHourlyCounts(List<HourlyCount> counts) {
        Map<NonNormalCountKey, NonNormalVolCount> rows = new HashMap<>();
        for (HourlyCount c : counts) {
            NonNormalCountKey key = new NonNormalCountKey(c.recordNum, c.hour.toLocalDate(), c.direction, c.lane);
            rows.computeIfAbsent(key, NonNormalVolCount::new).add(c.hour.getHour(), c.count);
        }
        return new ArrayList<>(new TreeMap<>(rows).values());
    }

    private static NonNormalCountKey keyFor(CountMetadata metadata, IndividualVehicle v, EdgeHours edges) {
        if (edges.contains(v.dateTime())) {
            return null;
        }
        Direction direction = metadata.directions.forChannel(v.channel);
        if (direction == null) {
            LOG.error("{}: vehicle on channel {} at {} has no direction, skipped",
                    metadata.recordNum, v.channel, v.dateTime());
            return null;
        }
        return new NonNormalCountKey(metadata.recordNum, v.date, direction, v.channel);
    }

    private static List<List<Double>> emptyHours() {
        List<List<Double>> hours = new ArrayList<>(HourColumns.HOURS);
        for (int i = 0; i < HourColumns.HOURS; i++) {
            hours.add(new ArrayList<>());
        }
        return hours;
    }

    /**
     * First and last hour of a count.
     */
    private static final class EdgeHours {

        private final LocalDateTime first;
        private final LocalDateTime last;

        private EdgeHours(LocalDateTime first, LocalDateTime last) {
            this.first = first;
            this.last = last;
        }

        static EdgeHours of(List<IndividualVehicle> vehicles) {
            LocalDateTime min = null;
            LocalDateTime max = null;
            for (IndividualVehicle v : vehicles) {
                LocalDateTime dt = v.dateTime();
                if (min == null || dt.isBefore(min)) {
                    min = dt;
                }
                if (max == null || dt.isAfter(max)) {
                    max = dt;
                }
            }
            return new EdgeHours(
                    min == null ? null : min.truncatedTo(ChronoUnit.HOURS),
                    max == null ? null : max.truncatedTo(ChronoUnit.HOURS));
        }

        boolean contains(LocalDateTime dt) {
            LocalDateTime hour = dt.truncatedTo(ChronoUnit.HOURS);
            return hour.equals(first) || hour.equals(last);
        }
    }
}
