package com.traffic.counts.aadv;

import com.traffic.counts.common.CountKind;

/**
 * Stored binned count tables an AADV can be calculated from, with the column
 * layout of each.
 */
public enum BinnedTable {
    CLASS("tc_clacount", "total", "recordnum", "ctdir", null, null),
    FIFTEEN_MINUTE_VEHICLE("tc_15minvolcount", "volcount", "recordnum", "cntdir", null, null),
    BICYCLE("tc_bikecount", "total", "dvrpcnum", null, "incount", "outcount"),
    PEDESTRIAN("tc_pedcount", "total", "dvrpcnum", null, "`in`", "`out`");

    public final String table;
    public final String totalField;
    public final String recordNumField;
    /**
     * Direction column for tables holding one row per direction.
     */
    public final String directionField;
    /**
     * In/out columns for tables holding both directions in each row.
     */
    public final String inField;
    public final String outField;

    BinnedTable(String table, String totalField, String recordNumField, String directionField,
                String inField, String outField) {
        this.table = table;
        this.totalField = totalField;
        this.recordNumField = recordNumField;
        this.directionField = directionField;
        this.inField = inField;
        this.outField = outField;
    }

    public boolean splitsInOut() {
        return inField != null;
    }

    public static BinnedTable forKind(CountKind kind) {
        switch (kind) {
            case INDIVIDUAL_VEHICLE:
                return CLASS;
            case FIFTEEN_MINUTE_VEHICLE:
                return FIFTEEN_MINUTE_VEHICLE;
            case FIFTEEN_MINUTE_BICYCLE:
                return BICYCLE;
            case FIFTEEN_MINUTE_PEDESTRIAN:
                return PEDESTRIAN;
            default:
                throw new IllegalArgumentException("No binned table for " + kind);
        }
    }
}
