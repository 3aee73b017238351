package com.traffic.counts.util;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Snaps timestamps to the start of their time bin and enumerates bins.
 */
public final class TimeBins {

    private TimeBins() {
    }

    /**
     * Start of the bin containing {@code time}: seconds dropped, minute snapped
     * to 0/15/30/45 (fifteen-minute) or 0 (hourly).
     */
    public static LocalTime binTime(LocalTime time, TimeInterval interval) {
        LocalTime t = time.withSecond(0).withNano(0);
        switch (interval) {
            case HOURLY:
                return t.withMinute(0);
            case FIFTEEN_MIN:
            default:
                int minute = t.getMinute();
                if (minute < 15) {
                    return t.withMinute(0);
                } else if (minute < 30) {
                    return t.withMinute(15);
                } else if (minute < 45) {
                    return t.withMinute(30);
                }
                return t.withMinute(45);
        }
    }

    public static LocalDateTime binDateTime(LocalDateTime dateTime, TimeInterval interval) {
        return LocalDateTime.of(dateTime.toLocalDate(), binTime(dateTime.toLocalTime(), interval));
    }

    /**
     * Every bin start from the bin of {@code first} to the bin of {@code last},
     * inclusive, including bins no observation fell into.
     */
    public static List<LocalDateTime> createTimeBins(LocalDateTime first, LocalDateTime last, TimeInterval interval) {
        LocalDateTime start = binDateTime(first, interval);
        LocalDateTime end = binDateTime(last, interval);
        if (end.isBefore(start)) {
            return Collections.emptyList();
        }
        List<LocalDateTime> bins = new ArrayList<>();
        for (LocalDateTime bin = start; !bin.isAfter(end); bin = bin.plusMinutes(interval.minutes())) {
            bins.add(bin);
        }
        return bins;
    }
}
