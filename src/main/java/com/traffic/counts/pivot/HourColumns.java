package com.traffic.counts.pivot;

/**
 * Names of the 24 hour-of-day columns of the pivoted tables.
 */
public final class HourColumns {

    public static final int HOURS = 24;

    private static final String[] NAMES = {
            "am12", "am1", "am2", "am3", "am4", "am5", "am6", "am7", "am8", "am9", "am10", "am11",
            "pm12", "pm1", "pm2", "pm3", "pm4", "pm5", "pm6", "pm7", "pm8", "pm9", "pm10", "pm11"
    };

    private HourColumns() {
    }

    public static String name(int hour) {
        return NAMES[hour];
    }

    public static String joined() {
        return String.join(", ", NAMES);
    }
}
