package com.traffic.counts.aadv;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.traffic.counts.common.BadIntervalCountException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FullDayDetectorTest {

    /**
     * {@code perStep} rows every {@code minutes} from {@code first} to {@code last}, inclusive.
     */
    static List<LocalDateTime> times(LocalDateTime first, LocalDateTime last, int minutes, int perStep) {
        List<LocalDateTime> times = new ArrayList<>();
        for (LocalDateTime t = first; !t.isAfter(last); t = t.plusMinutes(minutes)) {
            for (int i = 0; i < perStep; i++) {
                times.add(t);
            }
        }
        return times;
    }

    @Test void testSingleHourlyDay() throws BadIntervalCountException {
        List<LocalDateTime> times = times(LocalDateTime.of(2023, 11, 7, 0, 0), LocalDateTime.of(2023, 11, 7, 23, 0), 60, 1);
        assertEquals(List.of(LocalDate.of(2023, 11, 7)), FullDayDetector.fullDays(times));
    }

    @Test void testPartialEdgesDropped() throws BadIntervalCountException {
        List<LocalDateTime> times = times(LocalDateTime.of(2023, 11, 6, 10, 0), LocalDateTime.of(2023, 11, 10, 9, 45), 15, 1);
        assertEquals(List.of(LocalDate.of(2023, 11, 7), LocalDate.of(2023, 11, 8), LocalDate.of(2023, 11, 9)),
                FullDayDetector.fullDays(times));
    }

    @Test void testTwoDirectionsFifteenMinute() throws BadIntervalCountException {
        List<LocalDateTime> times = times(LocalDateTime.of(2023, 11, 6, 11, 0), LocalDateTime.of(2023, 11, 8, 23, 45), 15, 2);
        assertEquals(List.of(LocalDate.of(2023, 11, 7), LocalDate.of(2023, 11, 8)), FullDayDetector.fullDays(times));
    }

    @Test void testTwoDirectionsHourly() throws BadIntervalCountException {
        List<LocalDateTime> times = times(LocalDateTime.of(2023, 11, 7, 0, 0), LocalDateTime.of(2023, 11, 8, 12, 0), 60, 2);
        assertEquals(List.of(LocalDate.of(2023, 11, 7)), FullDayDetector.fullDays(times));
    }

    @Test void testOneFullDayBetweenPartialDays() throws BadIntervalCountException {
        List<LocalDateTime> times = times(LocalDateTime.of(2023, 11, 6, 10, 0), LocalDateTime.of(2023, 11, 8, 9, 45), 15, 1);
        assertEquals(Collections.singletonList(LocalDate.of(2023, 11, 7)), FullDayDetector.fullDays(times));
    }

    @Test void testEmpty() throws BadIntervalCountException {
        assertTrue(FullDayDetector.fullDays(new ArrayList<>()).isEmpty());
    }

    @Test void testUnexpectedRowCount() {
        List<LocalDateTime> times = times(LocalDateTime.of(2023, 11, 7, 0, 0), LocalDateTime.of(2023, 11, 7, 9, 0), 60, 1);
        BadIntervalCountException e = assertThrows(BadIntervalCountException.class, () -> FullDayDetector.fullDays(times));
        assertEquals(10, e.getRowCount());
    }

    @Test void testFirstBinTrimmedAfterMidnight() {
        // first 00:00 bin of a two-direction count dropped by the edge trim
        List<LocalDateTime> times = times(LocalDateTime.of(2023, 3, 5, 0, 15), LocalDateTime.of(2023, 3, 7, 23, 45), 15, 2);
        BadIntervalCountException e = assertThrows(BadIntervalCountException.class, () -> FullDayDetector.fullDays(times));
        assertEquals(190, e.getRowCount());
        assertTrue(e.getMessage().contains("190 rows on first full day"));
    }

    @Test void testCombine() {
        assertEquals(LocalDateTime.of(2023, 11, 7, 13, 15),
                FullDayDetector.combine(LocalDate.of(2023, 11, 7), LocalDateTime.of(1970, 1, 1, 13, 15)));
        assertEquals(LocalDateTime.of(2023, 11, 7, 13, 15),
                FullDayDetector.combine(LocalDate.of(2023, 11, 7), LocalDateTime.of(LocalDate.of(2023, 11, 7), LocalTime.of(13, 15))));
    }
}
