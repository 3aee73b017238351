package com.traffic.counts.aadv;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.traffic.counts.common.BadIntervalCountException;
import com.traffic.counts.common.CountDbException;
import com.traffic.counts.common.CountException;
import com.traffic.counts.common.Direction;
import com.traffic.counts.common.InvalidMcdException;

/**
 * Annual average daily volume: full-day totals per direction, weighted by
 * seasonal, axle and equipment factors and averaged over the days counted.
 */
public class AadvCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(AadvCalculator.class);

    private final CountDataSource source;

    public AadvCalculator(CountDataSource source) {
        this.source = source;
    }

    public List<LocalDate> fullDates(BinnedTable table, int recordNum) throws CountDbException, BadIntervalCountException {
        return FullDayDetector.fullDays(source.countTimes(table, recordNum));
    }

    /**
     * Totals of full days, per direction and across directions (null direction).
     */
    public Map<DayTotalKey, Long> totalsByDate(BinnedTable table, int recordNum) throws CountException {
        Set<LocalDate> dates = new HashSet<>(fullDates(table, recordNum));
        Map<DayTotalKey, Long> totals = new HashMap<>();

        if (table.splitsInOut()) {
            HeaderInfo header = requireHeader(recordNum);
            if (header.inDir == null || header.outDir == null) {
                throw new CountDbException("NULL value for 'indir' or 'outdir' field in tc_header table for " + recordNum);
            }
            Direction in = Direction.fromDbValue(header.inDir);
            Direction out = Direction.fromDbValue(header.outDir);
            for (InOutTotal t : source.inOutTotalsByDate(table, recordNum)) {
                if (!dates.contains(t.date)) {
                    continue;
                }
                totals.put(new DayTotalKey(t.date, in), t.in);
                totals.put(new DayTotalKey(t.date, out), t.out);
                totals.put(new DayTotalKey(t.date, null), t.total);
            }
            return totals;
        }

        for (DirectionTotal t : source.totalsByDateAndDirection(table, recordNum)) {
            if (!dates.contains(t.date)) {
                continue;
            }
            if (t.direction != null) {
                totals.put(new DayTotalKey(t.date, Direction.fromDbValue(t.direction)), t.total);
            }
            totals.merge(new DayTotalKey(t.date, null), t.total, Long::sum);
        }
        return totals;
    }

    public Map<DayTotalKey, Long> totalsByNonExcludedDate(BinnedTable table, int recordNum) throws CountException {
        Map<DayTotalKey, Long> totals = totalsByDate(table, recordNum);
        Set<LocalDate> excluded = source.excludedDays();
        totals.keySet().removeIf(k -> excluded.contains(k.date));
        return totals;
    }

    public AadvResult calculate(BinnedTable table, int recordNum) throws CountException {
        Map<DayTotalKey, Long> dayTotals = totalsByNonExcludedDate(table, recordNum);
        if (dayTotals.isEmpty()) {
            throw new CountException("No full days of data to calculate AADV for " + recordNum);
        }
        HeaderInfo header = requireHeader(recordNum);
        double equipment = source.equipmentFactor(header.countType).orElse(1.0);

        FactorColumns columns = null;
        if (table == BinnedTable.CLASS || table == BinnedTable.FIFTEEN_MINUTE_VEHICLE) {
            columns = FactorColumns.forMcd(header.mcd);
            if (header.fc == null) {
                throw new CountDbException("NULL value for 'fc' field in tc_header table for " + recordNum);
            }
        }

        Map<DayTotalKey, Double> weighted = new HashMap<>();
        for (Map.Entry<DayTotalKey, Long> e : dayTotals.entrySet()) {
            LocalDate date = e.getKey().date;
            double factor;
            switch (table) {
                case CLASS:
                    factor = source.seasonalFactor(columns.season, header.fc, date);
                    break;
                case FIFTEEN_MINUTE_VEHICLE:
                    factor = source.seasonalFactor(columns.season, header.fc, date)
                            * source.axleFactor(columns.axle, header.fc, date);
                    break;
                case BICYCLE:
                    factor = source.bicycleFactor(header.bikePedGroup, date);
                    break;
                case PEDESTRIAN:
                    factor = source.pedestrianFactor(date.getMonthValue());
                    break;
                default:
                    throw new IllegalStateException("Unhandled table " + table);
            }
            weighted.put(e.getKey(), e.getValue() * factor * equipment);
        }

        Set<Direction> directions = new LinkedHashSet<>();
        boolean hasOverall = false;
        for (DayTotalKey k : weighted.keySet()) {
            if (k.direction == null) {
                hasOverall = true;
            } else {
                directions.add(k.direction);
            }
        }
        int directionKeys = directions.size() + (hasOverall ? 1 : 0);
        // average full days per direction, truncated; exact only when every
        // direction has the same number of full days
        if (weighted.size() % directionKeys != 0) {
            LOG.warn("{}: directions have unequal numbers of full days ({} totals over {} directions)",
                    recordNum, weighted.size(), directionKeys);
        }
        double divisor = weighted.size() / directionKeys;

        Double overall = null;
        Map<Direction, Double> byDirection = new EnumMap<>(Direction.class);
        for (Map.Entry<DayTotalKey, Double> e : weighted.entrySet()) {
            Direction d = e.getKey().direction;
            if (d == null) {
                overall = (overall == null ? 0.0 : overall) + e.getValue();
            } else {
                byDirection.merge(d, e.getValue(), Double::sum);
            }
        }
        if (overall != null) {
            overall = overall / divisor;
        }
        byDirection.replaceAll((d, sum) -> sum / divisor);
        return new AadvResult(overall, byDirection);
    }

    /**
     * Calculate and replace the stored AADV of the record for {@code today}.
     * Nothing is stored when the calculation fails.
     */
    public AadvResult calculateAndStore(BinnedTable table, int recordNum, AadvStore store, LocalDate today)
            throws CountException {
        AadvResult result = calculate(table, recordNum);
        store.replaceAadv(recordNum, result, today);
        return result;
    }

    /**
     * Day of week numbered 1 (Sunday) to 7 (Saturday), as the factor tables key it.
     */
    public static int dayOfWeekFromSunday(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7 + 1;
    }

    private HeaderInfo requireHeader(int recordNum) throws CountDbException {
        return source.header(recordNum)
                .orElseThrow(() -> new CountDbException(recordNum + " not found in tc_header table"));
    }

    /**
     * Seasonal and axle factor columns of the state a count was taken in.
     */
    static final class FactorColumns {

        final String season;
        final String axle;

        private FactorColumns(String season, String axle) {
            this.season = season;
            this.axle = axle;
        }

        static FactorColumns forMcd(String mcd) throws InvalidMcdException {
            if (mcd != null && mcd.startsWith("42")) {
                return new FactorColumns("pafactor", "paaxle");
            }
            if (mcd != null && mcd.startsWith("34")) {
                return new FactorColumns("njfactor", "njaxle");
            }
            throw new InvalidMcdException(mcd);
        }
    }
}
