package com.traffic.counts.common;

public class CountDbException extends CountException {

    private static final long serialVersionUID = 1L;

    public CountDbException(String message) {
        super(message);
    }

    public CountDbException(String message, Throwable cause) {
        super(message, cause);
    }
}
