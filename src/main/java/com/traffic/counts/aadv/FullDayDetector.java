package com.traffic.counts.aadv;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.traffic.counts.common.BadIntervalCountException;

/**
 * Finds the calendar days of a count that have a complete set of intervals.
 * Whether the data is hourly or fifteen-minute is decided by the number of
 * rows on the first candidate day.
 */
public final class FullDayDetector {

    private FullDayDetector() {
    }

    /**
     * Rows written before the date and time columns were merged keep the date
     * in {@code countDate} and only the time in {@code countTime}.
     */
    public static LocalDateTime combine(LocalDate countDate, LocalDateTime countTime) {
        return LocalDateTime.of(countDate, countTime.toLocalTime());
    }

    /**
     * @param times row timestamps of one count, ordered ascending
     * @return every full date from the first to the last, inclusive
     */
    public static List<LocalDate> fullDays(List<LocalDateTime> times) throws BadIntervalCountException {
        if (times.isEmpty()) {
            return Collections.emptyList();
        }
        LocalDateTime firstDt = times.get(0);
        LocalDateTime lastDt = times.get(times.size() - 1);

        LocalDate firstFull = firstDt.toLocalDate();
        if (firstDt.getHour() != 0) {
            firstFull = firstFull.plusDays(1);
        }

        int rowsOnFirstDay = 0;
        for (LocalDateTime t : times) {
            if (t.toLocalDate().equals(firstFull)) {
                rowsOnFirstDay++;
            }
        }
        int lastMinute;
        switch (rowsOnFirstDay) {
            case 24: // hourly, one direction
            case 48: // hourly, two directions
                lastMinute = 0;
                break;
            case 96:
            case 192:
                lastMinute = 45;
                break;
            default:
                throw new BadIntervalCountException(rowsOnFirstDay);
        }

        LocalDate lastFull = lastDt.toLocalDate();
        if (lastDt.getHour() != 23 || lastDt.getMinute() != lastMinute) {
            lastFull = lastFull.minusDays(1);
        }

        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = firstFull; !d.isAfter(lastFull); d = d.plusDays(1)) {
            days.add(d);
        }
        return days;
    }
}
