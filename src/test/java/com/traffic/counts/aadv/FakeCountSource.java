package com.traffic.counts.aadv;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.traffic.counts.common.CountDbException;
import com.traffic.counts.pivot.HourlyCount;

/**
 * In-memory count database for one record.
 */
class FakeCountSource implements CountDataSource {

    List<LocalDateTime> times = new ArrayList<>();
    List<DirectionTotal> directionTotals = new ArrayList<>();
    List<InOutTotal> inOutTotals = new ArrayList<>();
    HeaderInfo header;
    Map<String, Double> equipmentFactors = new HashMap<>();
    double seasonalFactor = 1.0;
    double axleFactor = 1.0;
    /** keyed by day of week, Sunday = 1 */
    Map<Integer, Double> bicycleFactors = new HashMap<>();
    Map<Integer, Double> pedestrianFactors = new HashMap<>();
    Set<LocalDate> excluded = new HashSet<>();

    @Override
    public List<LocalDateTime> countTimes(BinnedTable table, int recordNum) {
        return times;
    }

    @Override
    public List<DirectionTotal> totalsByDateAndDirection(BinnedTable table, int recordNum) {
        return directionTotals;
    }

    @Override
    public List<InOutTotal> inOutTotalsByDate(BinnedTable table, int recordNum) {
        return inOutTotals;
    }

    @Override
    public List<HourlyCount> hourlyCounts(BinnedTable table, int recordNum) {
        return new ArrayList<>();
    }

    @Override
    public Optional<HeaderInfo> header(int recordNum) {
        return header != null && header.recordNum == recordNum ? Optional.of(header) : Optional.empty();
    }

    @Override
    public Optional<Double> equipmentFactor(String countType) {
        return Optional.ofNullable(equipmentFactors.get(countType));
    }

    @Override
    public double seasonalFactor(String column, int fc, LocalDate date) {
        return seasonalFactor;
    }

    @Override
    public double axleFactor(String column, int fc, LocalDate date) {
        return axleFactor;
    }

    @Override
    public double bicycleFactor(String bikePedGroup, LocalDate date) throws CountDbException {
        Double f = bicycleFactors.get(AadvCalculator.dayOfWeekFromSunday(date));
        if (f == null) {
            throw new CountDbException("No bicycle factor for " + date);
        }
        return f;
    }

    @Override
    public double pedestrianFactor(int month) throws CountDbException {
        Double f = pedestrianFactors.get(month);
        if (f == null) {
            throw new CountDbException("No pedestrian factor for month " + month);
        }
        return f;
    }

    @Override
    public Set<LocalDate> excludedDays() {
        return excluded;
    }
}
