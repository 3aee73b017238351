package com.traffic.counts.common;

public class BadVehicleClassException extends CountException {

    private static final long serialVersionUID = 1L;

    public BadVehicleClassException(int num) {
        super("No such vehicle class: " + num);
    }
}
