package com.traffic.counts.aadv;

import java.time.LocalDate;

import com.traffic.counts.common.CountDbException;

public interface AadvStore {

    /**
     * Replace every AADV stored for the record on {@code calculated} with
     * {@code result}. Either all of the new values are stored or none.
     */
    void replaceAadv(int recordNum, AadvResult result, LocalDate calculated) throws CountDbException;
}
