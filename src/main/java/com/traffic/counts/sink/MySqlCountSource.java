package com.traffic.counts.sink;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.traffic.counts.aadv.AadvCalculator;
import com.traffic.counts.aadv.BinnedTable;
import com.traffic.counts.aadv.CountDataSource;
import com.traffic.counts.aadv.DirectionTotal;
import com.traffic.counts.aadv.FullDayDetector;
import com.traffic.counts.aadv.HeaderInfo;
import com.traffic.counts.aadv.InOutTotal;
import com.traffic.counts.common.CountDbException;
import com.traffic.counts.common.Direction;
import com.traffic.counts.pivot.HourlyCount;

/**
 * {@link CountDataSource} over the MySQL count database.
 */
public class MySqlCountSource implements CountDataSource {

    private final Connection conn;

    public MySqlCountSource(Connection conn) {
        this.conn = conn;
    }

    @Override
    public List<LocalDateTime> countTimes(BinnedTable table, int recordNum) throws CountDbException {
        String sql = "select countdate, counttime from " + table.table + " where " + table.recordNumField
                + " = ? order by countdate, counttime";
        List<LocalDateTime> times = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, recordNum);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Timestamp time = rs.getTimestamp(2);
                    times.add(FullDayDetector.combine(rs.getDate(1).toLocalDate(), time.toLocalDateTime()));
                }
            }
        } catch (SQLException e) {
            throw wrap("Error reading count times from " + table.table + " for " + recordNum, e);
        }
        return times;
    }

    @Override
    public List<DirectionTotal> totalsByDateAndDirection(BinnedTable table, int recordNum) throws CountDbException {
        if (table.directionField == null) {
            throw new IllegalArgumentException(table.table + " has no direction column");
        }
        String sql = "select countdate, sum(" + table.totalField + "), " + table.directionField
                + " from " + table.table + " where " + table.recordNumField + " = ?"
                + " group by countdate, " + table.directionField;
        List<DirectionTotal> totals = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, recordNum);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    totals.add(new DirectionTotal(rs.getDate(1).toLocalDate(), rs.getLong(2), rs.getString(3)));
                }
            }
        } catch (SQLException e) {
            throw wrap("Error summing " + table.table + " by date and direction for " + recordNum, e);
        }
        return totals;
    }

    @Override
    public List<InOutTotal> inOutTotalsByDate(BinnedTable table, int recordNum) throws CountDbException {
        if (!table.splitsInOut()) {
            throw new IllegalArgumentException(table.table + " has no in/out columns");
        }
        String sql = "select countdate, sum(" + table.totalField + "), sum(" + table.inField + "), sum("
                + table.outField + ") from " + table.table + " where " + table.recordNumField + " = ?"
                + " group by countdate";
        List<InOutTotal> totals = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, recordNum);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    totals.add(new InOutTotal(rs.getDate(1).toLocalDate(), rs.getLong(2), rs.getLong(3), rs.getLong(4)));
                }
            }
        } catch (SQLException e) {
            throw wrap("Error summing " + table.table + " in/out by date for " + recordNum, e);
        }
        return totals;
    }

    @Override
    public List<HourlyCount> hourlyCounts(BinnedTable table, int recordNum) throws CountDbException {
        boolean directional = table.directionField != null;
        String groups = directional ? "countdate, hour(counttime), " + table.directionField + ", countlane"
                : "countdate, hour(counttime)";
        String sql = "select " + groups + ", sum(" + table.totalField + ") from " + table.table
                + " where " + table.recordNumField + " = ? group by " + groups + " order by " + groups;
        List<HourlyCount> counts = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, recordNum);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    LocalDateTime hour = rs.getDate(1).toLocalDate().atTime(rs.getInt(2), 0);
                    if (directional) {
                        String dir = rs.getString(3);
                        int lane = rs.getInt(4);
                        Integer laneOrNull = rs.wasNull() ? null : lane;
                        counts.add(new HourlyCount(recordNum, hour, rs.getInt(5),
                                dir == null ? null : Direction.fromDbValue(dir), laneOrNull));
                    } else {
                        counts.add(new HourlyCount(recordNum, hour, rs.getInt(3), null, null));
                    }
                }
            }
        } catch (SQLException e) {
            throw wrap("Error summing " + table.table + " by hour for " + recordNum, e);
        }
        return counts;
    }

    @Override
    public Optional<HeaderInfo> header(int recordNum) throws CountDbException {
        String sql = "select mcd, fc, type, bikepedgroup, indir, outdir from tc_header where recordnum = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, recordNum);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                HeaderInfo h = new HeaderInfo();
                h.recordNum = recordNum;
                h.mcd = rs.getString(1);
                int fc = rs.getInt(2);
                h.fc = rs.wasNull() ? null : fc;
                h.countType = rs.getString(3);
                h.bikePedGroup = rs.getString(4);
                h.inDir = rs.getString(5);
                h.outDir = rs.getString(6);
                return Optional.of(h);
            }
        } catch (SQLException e) {
            throw wrap("Error reading tc_header for " + recordNum, e);
        }
    }

    @Override
    public Optional<Double> equipmentFactor(String countType) throws CountDbException {
        if (countType == null) {
            return Optional.empty();
        }
        try (PreparedStatement ps = conn.prepareStatement("select factor2 from tc_counttype where counttype = ?")) {
            ps.setString(1, countType);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                double factor = rs.getDouble(1);
                return rs.wasNull() ? Optional.empty() : Optional.of(factor);
            }
        } catch (SQLException e) {
            throw wrap("Error reading equipment factor for count type " + countType, e);
        }
    }

    @Override
    public double seasonalFactor(String column, int fc, LocalDate date) throws CountDbException {
        return factFactor(column, fc, date);
    }

    @Override
    public double axleFactor(String column, int fc, LocalDate date) throws CountDbException {
        return factFactor(column, fc, date);
    }

    @Override
    public double bicycleFactor(String bikePedGroup, LocalDate date) throws CountDbException {
        String sql = "select factor from tc_bikefactor where type = ? and year = ? and monthnum = ? and dayofweeknum = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, bikePedGroup);
            ps.setInt(2, date.getYear());
            ps.setInt(3, date.getMonthValue());
            ps.setInt(4, AadvCalculator.dayOfWeekFromSunday(date));
            return singleDouble(ps, "No tc_bikefactor row for group " + bikePedGroup + " on " + date);
        } catch (SQLException e) {
            throw wrap("Error reading tc_bikefactor for " + date, e);
        }
    }

    @Override
    public double pedestrianFactor(int month) throws CountDbException {
        try (PreparedStatement ps = conn.prepareStatement("select factor from tc_pedfactor where month = ?")) {
            ps.setInt(1, month);
            return singleDouble(ps, "No tc_pedfactor row for month " + month);
        } catch (SQLException e) {
            throw wrap("Error reading tc_pedfactor for month " + month, e);
        }
    }

    @Override
    public Set<LocalDate> excludedDays() throws CountDbException {
        Set<LocalDate> days = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement("select excluded_day from aadv_excluded_days");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                days.add(rs.getDate(1).toLocalDate());
            }
        } catch (SQLException e) {
            throw wrap("Error reading aadv_excluded_days", e);
        }
        return days;
    }

    private double factFactor(String column, int fc, LocalDate date) throws CountDbException {
        String sql = "select " + column + " from tc_factor where fc = ? and year = ? and month = ? and dayofweek = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, fc);
            ps.setInt(2, date.getYear());
            ps.setInt(3, date.getMonthValue());
            ps.setInt(4, AadvCalculator.dayOfWeekFromSunday(date));
            return singleDouble(ps, "No tc_factor " + column + " for fc " + fc + " on " + date);
        } catch (SQLException e) {
            throw wrap("Error reading tc_factor " + column + " for " + date, e);
        }
    }

    private static double singleDouble(PreparedStatement ps, String missing) throws SQLException, CountDbException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new CountDbException(missing);
            }
            double value = rs.getDouble(1);
            if (rs.wasNull()) {
                throw new CountDbException(missing);
            }
            return value;
        }
    }

    private static CountDbException wrap(String message, SQLException e) {
        return new CountDbException(message + ": " + e.getMessage(), e);
    }
}
