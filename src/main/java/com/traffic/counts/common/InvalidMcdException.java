package com.traffic.counts.common;

/**
 * No seasonal factor column is mapped to the region code of a count.
 */
public class InvalidMcdException extends CountException {

    private static final long serialVersionUID = 1L;

    private final String mcd;

    public InvalidMcdException(String mcd) {
        super("Unrecognized region code (mcd): " + mcd);
        this.mcd = mcd;
    }

    public String getMcd() {
        return mcd;
    }
}
