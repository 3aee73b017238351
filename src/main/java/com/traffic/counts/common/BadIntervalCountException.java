package com.traffic.counts.common;

/**
 * The first full day of a count holds a number of rows that matches neither
 * hourly nor fifteen-minute data.
 */
public class BadIntervalCountException extends CountException {

    private static final long serialVersionUID = 1L;

    private final int rowCount;

    public BadIntervalCountException(int rowCount) {
        super("Unable to determine interval of count: " + rowCount + " rows on first full day");
        this.rowCount = rowCount;
    }

    public int getRowCount() {
        return rowCount;
    }
}
