package com.traffic.counts.aadv;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.traffic.counts.common.CountDbException;
import com.traffic.counts.pivot.HourlyCount;

/**
 * Read access to stored counts, header rows and factor tables.
 */
public interface CountDataSource {

    /**
     * Timestamps of every stored row of a count, ordered ascending.
     */
    List<LocalDateTime> countTimes(BinnedTable table, int recordNum) throws CountDbException;

    /**
     * Daily totals grouped by date and direction column.
     */
    List<DirectionTotal> totalsByDateAndDirection(BinnedTable table, int recordNum) throws CountDbException;

    /**
     * Daily total, in and out sums for tables with in/out columns.
     */
    List<InOutTotal> inOutTotalsByDate(BinnedTable table, int recordNum) throws CountDbException;

    /**
     * Volumes summed per hour, direction and lane.
     */
    List<HourlyCount> hourlyCounts(BinnedTable table, int recordNum) throws CountDbException;

    Optional<HeaderInfo> header(int recordNum) throws CountDbException;

    /**
     * Equipment correction of a count type; empty when the type has none.
     */
    Optional<Double> equipmentFactor(String countType) throws CountDbException;

    double seasonalFactor(String column, int fc, LocalDate date) throws CountDbException;

    double axleFactor(String column, int fc, LocalDate date) throws CountDbException;

    double bicycleFactor(String bikePedGroup, LocalDate date) throws CountDbException;

    double pedestrianFactor(int month) throws CountDbException;

    /**
     * Holidays and other days never used in AADV calculations.
     */
    Set<LocalDate> excludedDays() throws CountDbException;
}
