package com.traffic.counts.common;

public class InvalidFileNameException extends CountException {

    private static final long serialVersionUID = 1L;

    /**
     * Which part of the file name could not be parsed.
     */
    public enum FileNameProblem {
        TOO_MANY_PARTS,
        TOO_FEW_PARTS,
        INVALID_TECH,
        INVALID_RECORD_NUM,
        INVALID_DIRECTIONS,
        INVALID_COUNTER_ID,
        INVALID_SPEED_LIMIT
    }

    private final FileNameProblem problem;

    public InvalidFileNameException(FileNameProblem problem, String fileName) {
        super("Invalid file name " + fileName + ": " + problem);
        this.problem = problem;
    }

    public FileNameProblem getProblem() {
        return problem;
    }
}
