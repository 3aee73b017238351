package com.traffic.counts.pivot;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

import com.traffic.counts.common.Direction;

/**
 * Identifies one pivoted hourly row. Direction and lane may be absent for
 * counts stored before directions were recorded.
 */
public final class NonNormalCountKey implements Comparable<NonNormalCountKey> {

    private static final Comparator<NonNormalCountKey> ORDER = Comparator
            .comparingInt((NonNormalCountKey k) -> k.recordNum)
            .thenComparing(k -> k.date)
            .thenComparing(k -> k.lane, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(k -> k.direction, Comparator.nullsFirst(Comparator.naturalOrder()));

    public final int recordNum;
    public final LocalDate date;
    public final Direction direction;
    public final Integer lane;

    public NonNormalCountKey(int recordNum, LocalDate date, Direction direction, Integer lane) {
        this.recordNum = recordNum;
        this.date = Objects.requireNonNull(date, "date");
        this.direction = direction;
        this.lane = lane;
    }

    @Override
    public int compareTo(NonNormalCountKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NonNormalCountKey)) {
            return false;
        }
        NonNormalCountKey other = (NonNormalCountKey) o;
        return recordNum == other.recordNum
                && date.equals(other.date)
                && direction == other.direction
                && Objects.equals(lane, other.lane);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordNum, date, direction, lane);
    }

    @Override
    public String toString() {
        return recordNum + "/" + date + "/" + direction + "/" + lane;
    }
}
