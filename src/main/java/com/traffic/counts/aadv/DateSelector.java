package com.traffic.counts.aadv;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Picks the date a count is filed under.
 */
public final class DateSelector {

    private DateSelector() {
    }

    /**
     * First weekday after the first (partial) day of the count.
     */
    public static Optional<LocalDate> determineDate(Collection<LocalDate> dates) {
        List<LocalDate> sorted = new ArrayList<>(new TreeSet<>(dates));
        if (sorted.size() < 2) {
            return Optional.empty();
        }
        for (LocalDate d : sorted.subList(1, sorted.size())) {
            DayOfWeek dow = d.getDayOfWeek();
            if (dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
