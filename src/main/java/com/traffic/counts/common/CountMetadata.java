package com.traffic.counts.common;

import java.io.Serializable;
import java.nio.file.Path;

import com.traffic.counts.common.InvalidFileNameException.FileNameProblem;

/**
 * Metadata carried in the name of a count file:
 * {@code [technician-]recordnum-directions-counterid-speedlimit.csv}, e.g.
 * {@code rc-166905-ew-40972-35.txt} or {@code 123456-s-101-na.csv}.
 */
public class CountMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Technician initials, null for names without them.
     */
    public String technician;
    public int recordNum;
    public Directions directions;
    public int counterId;
    /**
     * Null when the file name says "na".
     */
    public Integer speedLimit;

    public static CountMetadata fromPath(Path path) throws InvalidFileNameException {
        return fromFileName(path.getFileName().toString());
    }

    public static CountMetadata fromFileName(String fileName) throws InvalidFileNameException {
        String stem = fileName;
        int dot = stem.lastIndexOf('.');
        if (dot > 0) {
            stem = stem.substring(0, dot);
        }
        String[] parts = stem.split("-");
        if (parts.length < 4) {
            throw new InvalidFileNameException(FileNameProblem.TOO_FEW_PARTS, fileName);
        }
        if (parts.length > 5) {
            throw new InvalidFileNameException(FileNameProblem.TOO_MANY_PARTS, fileName);
        }

        CountMetadata m = new CountMetadata();
        int i = 0;
        if (parts.length == 5) {
            if (isInteger(parts[0])) {
                throw new InvalidFileNameException(FileNameProblem.INVALID_TECH, fileName);
            }
            m.technician = parts[0];
            i = 1;
        }

        if (!isInteger(parts[i])) {
            throw new InvalidFileNameException(FileNameProblem.INVALID_RECORD_NUM, fileName);
        }
        m.recordNum = Integer.parseInt(parts[i]);

        m.directions = Directions.fromCode(parts[i + 1]);
        if (m.directions == null) {
            throw new InvalidFileNameException(FileNameProblem.INVALID_DIRECTIONS, fileName);
        }

        if (!isInteger(parts[i + 2])) {
            throw new InvalidFileNameException(FileNameProblem.INVALID_COUNTER_ID, fileName);
        }
        m.counterId = Integer.parseInt(parts[i + 2]);

        String speed = parts[i + 3];
        if ("na".equals(speed)) {
            m.speedLimit = null;
        } else if (isInteger(speed)) {
            m.speedLimit = Integer.parseInt(speed);
        } else {
            throw new InvalidFileNameException(FileNameProblem.INVALID_SPEED_LIMIT, fileName);
        }
        return m;
    }

    private static boolean isInteger(String s) {
        if (s == null || s.isEmpty()) {
            return false;
        }
        try {
            Integer.parseInt(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
