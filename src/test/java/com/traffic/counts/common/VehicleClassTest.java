package com.traffic.counts.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class VehicleClassTest {

    @Test void testKnownClasses() throws BadVehicleClassException {
        for (int n = 1; n <= 13; n++) {
            assertEquals(n, VehicleClass.fromNum(n).num());
        }
        assertEquals(VehicleClass.MOTORCYCLES, VehicleClass.fromNum(1));
        assertEquals(VehicleClass.FIVE_AXLE_SINGLE_TRAILER, VehicleClass.fromNum(9));
    }

    @Test void testUnclassifiedCodes() throws BadVehicleClassException {
        assertEquals(VehicleClass.UNCLASSIFIED, VehicleClass.fromNum(0));
        assertEquals(VehicleClass.UNCLASSIFIED, VehicleClass.fromNum(14));
        assertEquals(VehicleClass.UNCLASSIFIED, VehicleClass.fromNum(15));
    }

    @Test void testInvalidClass() {
        assertThrows(BadVehicleClassException.class, () -> VehicleClass.fromNum(16));
        assertThrows(BadVehicleClassException.class, () -> VehicleClass.fromNum(-1));
    }
}
