package com.traffic.counts.aadv;

import java.time.LocalDate;
import java.util.Objects;

import com.traffic.counts.common.Direction;

/**
 * A full day and a direction. A null direction stands for the total across
 * all directions.
 */
public final class DayTotalKey {

    public final LocalDate date;
    public final Direction direction;

    public DayTotalKey(LocalDate date, Direction direction) {
        this.date = Objects.requireNonNull(date, "date");
        this.direction = direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DayTotalKey)) {
            return false;
        }
        DayTotalKey other = (DayTotalKey) o;
        return date.equals(other.date) && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, direction);
    }

    @Override
    public String toString() {
        return date + "/" + (direction == null ? "all" : direction.dbValue());
    }
}
