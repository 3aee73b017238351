package com.traffic.counts.check;

/**
 * Outcome of one data check.
 */
public class CheckResult {

    public enum Level {
        INFO,
        WARN
    }

    public final Level level;
    public final String message;

    private CheckResult(Level level, String message) {
        this.level = level;
        this.message = message;
    }

    public static CheckResult ok(String message) {
        return new CheckResult(Level.INFO, message);
    }

    public static CheckResult warn(String message) {
        return new CheckResult(Level.WARN, message);
    }

    public boolean isWarning() {
        return level == Level.WARN;
    }

    @Override
    public String toString() {
        return level + ": " + message;
    }
}
