package com.traffic.counts.common;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Channel to direction mapping of one count file. Channel 1 always has a
 * direction, channels 2 and 3 only when the file name encodes them.
 */
public class Directions implements Serializable {

    private static final long serialVersionUID = 1L;

    public final Direction direction1;
    public final Direction direction2;
    public final Direction direction3;

    public Directions(Direction direction1, Direction direction2, Direction direction3) {
        this.direction1 = Objects.requireNonNull(direction1, "direction1");
        if (direction2 == null && direction3 != null) {
            throw new IllegalArgumentException("direction3 requires direction2");
        }
        this.direction2 = direction2;
        this.direction3 = direction3;
    }

    public static Directions of(Direction direction1) {
        return new Directions(direction1, null, null);
    }

    public static Directions of(Direction direction1, Direction direction2) {
        return new Directions(direction1, direction2, null);
    }

    /**
     * Parse the direction part of a file name, e.g. "ew" or "nnn".
     *
     * @return null when the code is not recognized
     */
    public static Directions fromCode(String code) {
        switch (code) {
            case "n":
                return of(Direction.NORTH);
            case "s":
                return of(Direction.SOUTH);
            case "e":
                return of(Direction.EAST);
            case "w":
                return of(Direction.WEST);
            case "ns":
                return of(Direction.NORTH, Direction.SOUTH);
            case "sn":
                return of(Direction.SOUTH, Direction.NORTH);
            case "ew":
                return of(Direction.EAST, Direction.WEST);
            case "we":
                return of(Direction.WEST, Direction.EAST);
            case "nn":
                return of(Direction.NORTH, Direction.NORTH);
            case "ss":
                return of(Direction.SOUTH, Direction.SOUTH);
            case "ee":
                return of(Direction.EAST, Direction.EAST);
            case "ww":
                return of(Direction.WEST, Direction.WEST);
            case "nnn":
                return new Directions(Direction.NORTH, Direction.NORTH, Direction.NORTH);
            case "sss":
                return new Directions(Direction.SOUTH, Direction.SOUTH, Direction.SOUTH);
            case "eee":
                return new Directions(Direction.EAST, Direction.EAST, Direction.EAST);
            case "www":
                return new Directions(Direction.WEST, Direction.WEST, Direction.WEST);
            default:
                return null;
        }
    }

    /**
     * @return the direction recorded on the channel, or null if the channel is not in use
     */
    public Direction forChannel(int channel) {
        switch (channel) {
            case 1:
                return direction1;
            case 2:
                return direction2;
            case 3:
                return direction3;
            default:
                return null;
        }
    }

    /**
     * Channels in use, in ascending order.
     */
    public List<Integer> channels() {
        List<Integer> channels = new ArrayList<>(3);
        channels.add(1);
        if (direction2 != null) {
            channels.add(2);
        }
        if (direction3 != null) {
            channels.add(3);
        }
        return Collections.unmodifiableList(channels);
    }

    public boolean isBidirectional() {
        return direction2 != null && direction2 != direction1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Directions)) {
            return false;
        }
        Directions other = (Directions) o;
        return direction1 == other.direction1
                && direction2 == other.direction2
                && direction3 == other.direction3;
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction1, direction2, direction3);
    }

    @Override
    public String toString() {
        return "Directions{" + direction1 + ", " + direction2 + ", " + direction3 + "}";
    }
}
