package com.traffic.counts.common;

import java.util.Locale;

/**
 * Compass direction of a lane. Stored lowercase in the count tables.
 */
public enum Direction {
    NORTH,
    EAST,
    SOUTH,
    WEST;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Direction fromDbValue(String value) throws CountDbException {
        if (value == null) {
            throw new CountDbException("Missing direction value");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "north":
            case "n":
                return NORTH;
            case "east":
            case "e":
                return EAST;
            case "south":
            case "s":
                return SOUTH;
            case "west":
            case "w":
                return WEST;
            default:
                throw new CountDbException("Unrecognized direction: " + value);
        }
    }
}
