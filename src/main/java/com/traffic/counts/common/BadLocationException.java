package com.traffic.counts.common;

/**
 * A count file sits in a directory that does not name a known count kind.
 */
public class BadLocationException extends CountException {

    private static final long serialVersionUID = 1L;

    public BadLocationException(String directory) {
        super("Unknown count location: " + directory);
    }
}
