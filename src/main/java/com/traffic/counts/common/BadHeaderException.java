package com.traffic.counts.common;

public class BadHeaderException extends CountException {

    private static final long serialVersionUID = 1L;

    public BadHeaderException(String message) {
        super(message);
    }
}
