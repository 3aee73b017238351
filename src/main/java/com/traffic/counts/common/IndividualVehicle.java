package com.traffic.counts.common;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * One vehicle as recorded by a counter, before any binning.
 */
public class IndividualVehicle implements Serializable {

    private static final long serialVersionUID = 1L;

    public LocalDate date;
    public LocalTime time;
    public int channel;
    public VehicleClass vehicleClass;
    /**
     * Signed; counters report -0.0 for some stationary detections.
     */
    public double speed;

    public IndividualVehicle() {
    }

    public IndividualVehicle(LocalDate date, LocalTime time, int channel, VehicleClass vehicleClass, double speed) {
        this.date = date;
        this.time = time;
        this.channel = channel;
        this.vehicleClass = vehicleClass;
        this.speed = speed;
    }

    public LocalDateTime dateTime() {
        return LocalDateTime.of(date, time);
    }
}
