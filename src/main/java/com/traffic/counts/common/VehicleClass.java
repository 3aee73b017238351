package com.traffic.counts.common;

/**
 * FHWA vehicle classes as reported by the counters.
 */
public enum VehicleClass {
    MOTORCYCLES(1),
    PASSENGER_CARS(2),
    OTHER_FOUR_TIRE_SINGLE_UNIT(3),
    BUSES(4),
    TWO_AXLE_SIX_TIRE(5),
    THREE_AXLE_SINGLE_UNIT(6),
    FOUR_OR_MORE_AXLE_SINGLE_UNIT(7),
    FOUR_OR_LESS_AXLE_SINGLE_TRAILER(8),
    FIVE_AXLE_SINGLE_TRAILER(9),
    SIX_OR_MORE_AXLE_SINGLE_TRAILER(10),
    FIVE_OR_LESS_AXLE_MULTI_TRAILER(11),
    SIX_AXLE_MULTI_TRAILER(12),
    SEVEN_OR_MORE_AXLE_MULTI_TRAILER(13),
    UNCLASSIFIED(15);

    private final int num;

    VehicleClass(int num) {
        this.num = num;
    }

    public int num() {
        return num;
    }

    public static VehicleClass fromNum(int num) throws BadVehicleClassException {
        // counters report unclassified vehicles as 0, 14 or 15
        if (num == 0 || num == 14 || num == 15) {
            return UNCLASSIFIED;
        }
        if (num >= 1 && num <= 13) {
            return values()[num - 1];
        }
        throw new BadVehicleClassException(num);
    }
}
