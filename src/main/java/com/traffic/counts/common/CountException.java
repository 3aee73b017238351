package com.traffic.counts.common;

/**
 * Base type for every failure that should abort processing of a single count
 * while letting the batch move on to the next one.
 */
public class CountException extends Exception {

    private static final long serialVersionUID = 1L;

    public CountException(String message) {
        super(message);
    }

    public CountException(String message, Throwable cause) {
        super(message, cause);
    }
}
