package com.traffic.counts.check;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.traffic.counts.common.BikePedCount;
import com.traffic.counts.common.Direction;
import com.traffic.counts.common.JsonUtils;
import com.traffic.counts.common.VehicleClass;
import com.traffic.counts.count.VehicleClassCount;
import com.traffic.counts.pivot.HourlyCount;
import com.traffic.counts.pivot.NonNormalVolCount;

/**
 * Plausibility checks on freshly imported counts. Nothing here rejects data,
 * the results are only reported.
 */
public class DataChecker {

    private static final Logger LOG = LoggerFactory.getLogger(DataChecker.class);

    static final int ZERO_CHECK_START_HOUR = 4;
    static final int ZERO_CHECK_END_HOUR = 22;

    private final double directionLowerBound;
    private final int bikeMaxPerPeriod;
    private final double class2MinPercent;
    private final double unclassifiedMaxPercent;

    public DataChecker(double directionLowerBound, int bikeMaxPerPeriod, double class2MinPercent,
                       double unclassifiedMaxPercent) {
        this.directionLowerBound = directionLowerBound;
        this.bikeMaxPerPeriod = bikeMaxPerPeriod;
        this.class2MinPercent = class2MinPercent;
        this.unclassifiedMaxPercent = unclassifiedMaxPercent;
    }

    public static DataChecker fromProperties(Properties props) {
        return new DataChecker(
                JsonUtils.doubleProperty(props, "check.direction.lower.bound", 0.40),
                JsonUtils.intProperty(props, "check.bike.max.per.period", 20),
                JsonUtils.doubleProperty(props, "check.class2.min.percent", 75.0),
                JsonUtils.doubleProperty(props, "check.unclassified.max.percent", 10.0));
    }

    /**
     * Log every result of a count and return the warnings.
     */
    public static List<CheckResult> report(int recordNum, List<CheckResult> results) {
        List<CheckResult> warnings = new ArrayList<>();
        for (CheckResult r : results) {
            if (r.isWarning()) {
                LOG.warn("{}: {}", recordNum, r.message);
                warnings.add(r);
            } else {
                LOG.info("{}: {}", recordNum, r.message);
            }
        }
        return warnings;
    }

    public CheckResult checkClass2Share(List<VehicleClassCount> counts) {
        long total = 0;
        long c2 = 0;
        for (VehicleClassCount c : counts) {
            total += c.total;
            c2 += c.get(VehicleClass.PASSENGER_CARS);
        }
        if (total == 0) {
            return CheckResult.ok("Count is empty");
        }
        double percent = c2 * 100.0 / total;
        if (percent < class2MinPercent) {
            return CheckResult.warn(String.format(Locale.ROOT,
                    "Class 2 vehicles are less than %.0f%% (%.1f%%) of total.", class2MinPercent, percent));
        }
        return CheckResult.ok("Share of class 2 vehicles is within expectations");
    }

    public CheckResult checkUnclassifiedShare(List<VehicleClassCount> counts) {
        long total = 0;
        long c15 = 0;
        for (VehicleClassCount c : counts) {
            total += c.total;
            c15 += c.get(VehicleClass.UNCLASSIFIED);
        }
        if (total == 0) {
            return CheckResult.ok("Count is empty");
        }
        double percent = c15 * 100.0 / total;
        if (percent > unclassifiedMaxPercent) {
            return CheckResult.warn(String.format(Locale.ROOT,
                    "Unclassed vehicles are greater than %.0f%% (%.1f%%) of total.", unclassifiedMaxPercent, percent));
        }
        return CheckResult.ok("Share of unclassed vehicles is within expectations");
    }

    /**
     * Both directions of a two-way vehicle count should carry a comparable share.
     */
    public CheckResult checkDirectionProportions(List<NonNormalVolCount> counts) {
        Map<Direction, Long> byDirection = new TreeMap<>();
        for (NonNormalVolCount c : counts) {
            if (c.key.direction != null && c.totalCount != null) {
                byDirection.merge(c.key.direction, (long) c.totalCount, Long::sum);
            }
        }
        if (byDirection.isEmpty()) {
            return CheckResult.ok("Count is empty");
        }
        if (byDirection.size() < 2) {
            return CheckResult.ok("Skipping disproportional directionality check - count only one direction.");
        }
        List<Map.Entry<Direction, Long>> sorted = new ArrayList<>(byDirection.entrySet());
        sorted.sort(Map.Entry.comparingByValue());
        Map.Entry<Direction, Long> smaller = sorted.get(0);
        Map.Entry<Direction, Long> larger = sorted.get(sorted.size() - 1);
        return proportions(smaller.getKey().dbValue(), smaller.getValue(), larger.getKey().dbValue(), larger.getValue());
    }

    public CheckResult checkBikeDirectionProportions(List<BikePedCount> counts, Direction in, Direction out) {
        if (in == null || out == null || in == out) {
            return CheckResult.ok("Skipping disproportional directionality check - count only one direction.");
        }
        long inSum = 0;
        long outSum = 0;
        for (BikePedCount c : counts) {
            inSum += c.inCount == null ? 0 : c.inCount;
            outSum += c.outCount == null ? 0 : c.outCount;
        }
        if (inSum + outSum == 0) {
            return CheckResult.ok("Count is empty");
        }
        return inSum <= outSum
                ? proportions(in.dbValue(), inSum, out.dbValue(), outSum)
                : proportions(out.dbValue(), outSum, in.dbValue(), inSum);
    }

    public CheckResult checkExcessiveBicycles(List<BikePedCount> counts) {
        List<String> periods = new ArrayList<>();
        for (BikePedCount c : counts) {
            if (c.total > bikeMaxPerPeriod) {
                periods.add(c.dateTime() + ": " + c.total);
            }
        }
        if (periods.isEmpty()) {
            return CheckResult.ok("All counts under excessive threshold");
        }
        return CheckResult.warn("Found more than " + bikeMaxPerPeriod
                + " bicycles counted in the following periods: " + String.join("; ", periods));
    }

    /**
     * Two or more consecutive hours without traffic during the day, per direction.
     */
    public CheckResult checkConsecutiveZeroHours(List<HourlyCount> counts) {
        Map<String, TreeMap<LocalDateTime, Long>> byDirection = new TreeMap<>();
        for (HourlyCount c : counts) {
            int hour = c.hour.getHour();
            if (hour < ZERO_CHECK_START_HOUR || hour > ZERO_CHECK_END_HOUR) {
                continue;
            }
            String dir = c.direction == null ? "" : c.direction.dbValue();
            byDirection.computeIfAbsent(dir, k -> new TreeMap<>())
                    .merge(c.hour.truncatedTo(ChronoUnit.HOURS), (long) c.count, Long::sum);
        }
        for (TreeMap<LocalDateTime, Long> hours : byDirection.values()) {
            int zeros = 0;
            for (long volume : hours.values()) {
                zeros = volume == 0 ? zeros + 1 : 0;
                if (zeros > 1) {
                    return CheckResult.warn(String.format(Locale.ROOT,
                            "Consecutive periods between the hours of %d:00 and %d:00 with zero volumes.",
                            ZERO_CHECK_START_HOUR, ZERO_CHECK_END_HOUR));
                }
            }
        }
        return CheckResult.ok("No counts with consecutive hourly periods of 0 volume counted.");
    }

    /**
     * Hourly sums of bicycle or pedestrian periods, for the zero-hour check.
     */
    public static List<HourlyCount> hourlyTotals(List<BikePedCount> counts) {
        Map<LocalDateTime, Integer> sums = new TreeMap<>();
        int recordNum = 0;
        for (BikePedCount c : counts) {
            recordNum = c.recordNum;
            sums.merge(c.dateTime().truncatedTo(ChronoUnit.HOURS), c.total, Integer::sum);
        }
        List<HourlyCount> out = new ArrayList<>(sums.size());
        for (Map.Entry<LocalDateTime, Integer> e : sums.entrySet()) {
            out.add(new HourlyCount(recordNum, e.getKey(), e.getValue(), null, null));
        }
        return out;
    }

    private CheckResult proportions(String smallerName, long smaller, String largerName, long larger) {
        double total = smaller + larger;
        double smallerShare = smaller / total;
        double largerShare = larger / total;
        if (smallerShare < directionLowerBound) {
            return CheckResult.warn(String.format(Locale.ROOT,
                    "Abnormal direction proportions: %s has %.1f%% of total, %s has %.1f%%. "
                            + "(Expectation is that proportions are no less/more than %.0f%%/%.0f%%.)",
                    smallerName, smallerShare * 100, largerName, largerShare * 100,
                    directionLowerBound * 100, 100 - directionLowerBound * 100));
        }
        return CheckResult.ok("Direction proportions is within expectations");
    }
}
