package com.traffic.counts.common;

/**
 * Kinds of input files the importer understands, one per upload directory.
 */
public enum CountKind {
    INDIVIDUAL_VEHICLE("vehicle"),
    FIFTEEN_MINUTE_VEHICLE("15minutevehicle"),
    FIFTEEN_MINUTE_BICYCLE("15minutebicycle"),
    FIFTEEN_MINUTE_PEDESTRIAN("15minutepedestrian");

    private final String directoryName;

    CountKind(String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }

    public static CountKind fromDirectoryName(String name) throws BadLocationException {
        for (CountKind kind : values()) {
            if (kind.directoryName.equals(name)) {
                return kind;
            }
        }
        throw new BadLocationException(name);
    }
}
