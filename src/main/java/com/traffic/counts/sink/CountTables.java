package com.traffic.counts.sink;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;

import com.traffic.counts.common.BikePedCount;
import com.traffic.counts.common.Direction;
import com.traffic.counts.common.FifteenMinuteVehicle;
import com.traffic.counts.common.VehicleClass;
import com.traffic.counts.count.SpeedRangeCount;
import com.traffic.counts.count.VehicleClassCount;
import com.traffic.counts.pivot.HourColumns;
import com.traffic.counts.pivot.NonNormalAvgSpeedCount;
import com.traffic.counts.pivot.NonNormalVolCount;

/**
 * Batch writers for each count table. {@code countdate} holds the date only,
 * {@code counttime} the full timestamp.
 */
public final class CountTables {

    private static final VehicleClass[] CLASS_COLUMNS_ORDER = {
            VehicleClass.MOTORCYCLES,
            VehicleClass.PASSENGER_CARS,
            VehicleClass.OTHER_FOUR_TIRE_SINGLE_UNIT,
            VehicleClass.BUSES,
            VehicleClass.TWO_AXLE_SIX_TIRE,
            VehicleClass.THREE_AXLE_SINGLE_UNIT,
            VehicleClass.FOUR_OR_MORE_AXLE_SINGLE_UNIT,
            VehicleClass.FOUR_OR_LESS_AXLE_SINGLE_TRAILER,
            VehicleClass.FIVE_AXLE_SINGLE_TRAILER,
            VehicleClass.SIX_OR_MORE_AXLE_SINGLE_TRAILER,
            VehicleClass.FIVE_OR_LESS_AXLE_MULTI_TRAILER,
            VehicleClass.SIX_AXLE_MULTI_TRAILER,
            VehicleClass.SEVEN_OR_MORE_AXLE_MULTI_TRAILER,
            VehicleClass.UNCLASSIFIED
    };

    private CountTables() {
    }

    public static MySqlBatchSink<VehicleClassCount> classCounts(Connection conn, int batchSize) {
        String sql = "insert into tc_clacount (recordnum, countdate, counttime, countlane, total, ctdir, "
                + "bikes, cars_and_tlrs, ax2_long, buses, ax2_6_tire, ax3_single, ax4_single, lt_5_ax_double, "
                + "ax5_double, gt_5_ax_double, lt_6_ax_multi, ax6_multi, gt_6_ax_multi, unclassified) "
                + "values (" + placeholders(20) + ")";
        return new MySqlBatchSink<>(conn, "tc_clacount", "recordnum", sql, (ps, c) -> {
            ps.setInt(1, c.recordNum);
            ps.setDate(2, Date.valueOf(c.dateTime.toLocalDate()));
            ps.setTimestamp(3, Timestamp.valueOf(c.dateTime));
            ps.setInt(4, c.channel);
            ps.setInt(5, c.total);
            ps.setString(6, c.direction.dbValue());
            int i = 7;
            for (VehicleClass vc : CLASS_COLUMNS_ORDER) {
                ps.setInt(i++, c.get(vc));
            }
        }, batchSize);
    }

    public static MySqlBatchSink<SpeedRangeCount> speedCounts(Connection conn, int batchSize) {
        StringBuilder bands = new StringBuilder();
        for (int b = 1; b <= SpeedRangeCount.BANDS; b++) {
            bands.append(", s").append(b);
        }
        String sql = "insert into tc_specount (recordnum, countdate, counttime, countlane, total, ctdir"
                + bands + ") values (" + placeholders(6 + SpeedRangeCount.BANDS) + ")";
        return new MySqlBatchSink<>(conn, "tc_specount", "recordnum", sql, (ps, c) -> {
            ps.setInt(1, c.recordNum);
            ps.setDate(2, Date.valueOf(c.dateTime.toLocalDate()));
            ps.setTimestamp(3, Timestamp.valueOf(c.dateTime));
            ps.setInt(4, c.channel);
            ps.setInt(5, c.total);
            ps.setString(6, c.direction.dbValue());
            for (int b = 1; b <= SpeedRangeCount.BANDS; b++) {
                ps.setInt(6 + b, c.band(b));
            }
        }, batchSize);
    }

    public static MySqlBatchSink<FifteenMinuteVehicle> fifteenMinuteVehicles(Connection conn, int batchSize) {
        String sql = "insert into tc_15minvolcount (recordnum, countdate, counttime, volcount, cntdir, countlane) "
                + "values (?, ?, ?, ?, ?, ?)";
        return new MySqlBatchSink<>(conn, "tc_15minvolcount", "recordnum", sql, (ps, c) -> {
            ps.setInt(1, c.recordNum);
            ps.setDate(2, Date.valueOf(c.date));
            ps.setTimestamp(3, Timestamp.valueOf(c.dateTime()));
            ps.setInt(4, c.count);
            ps.setString(5, c.direction.dbValue());
            ps.setInt(6, c.channel);
        }, batchSize);
    }

    public static MySqlBatchSink<BikePedCount> bicycleCounts(Connection conn, int batchSize) {
        return bikePed(conn, "tc_bikecount", "incount", "outcount", batchSize);
    }

    public static MySqlBatchSink<BikePedCount> pedestrianCounts(Connection conn, int batchSize) {
        return bikePed(conn, "tc_pedcount", "`in`", "`out`", batchSize);
    }

    private static MySqlBatchSink<BikePedCount> bikePed(Connection conn, String table, String inField,
                                                        String outField, int batchSize) {
        String sql = "insert into " + table + " (dvrpcnum, countdate, counttime, total, " + inField + ", "
                + outField + ") values (?, ?, ?, ?, ?, ?)";
        return new MySqlBatchSink<>(conn, table, "dvrpcnum", sql, (ps, c) -> {
            ps.setInt(1, c.recordNum);
            ps.setDate(2, Date.valueOf(c.date));
            ps.setTimestamp(3, Timestamp.valueOf(c.dateTime()));
            ps.setInt(4, c.total);
            setInteger(ps, 5, c.inCount);
            setInteger(ps, 6, c.outCount);
        }, batchSize);
    }

    public static MySqlBatchSink<NonNormalVolCount> volumeCounts(Connection conn, int batchSize) {
        String sql = "insert into tc_volcount (recordnum, countdate, setflag, totalcount, cntdir, countlane, "
                + HourColumns.joined() + ") values (" + placeholders(6 + HourColumns.HOURS) + ")";
        return new MySqlBatchSink<>(conn, "tc_volcount", "recordnum", sql, (ps, c) -> {
            ps.setInt(1, c.key.recordNum);
            ps.setDate(2, Date.valueOf(c.key.date));
            setInteger(ps, 3, c.setFlag);
            setInteger(ps, 4, c.totalCount);
            setDirection(ps, 5, c.key.direction);
            setInteger(ps, 6, c.key.lane);
            for (int h = 0; h < HourColumns.HOURS; h++) {
                setInteger(ps, 7 + h, c.hour(h));
            }
        }, batchSize);
    }

    public static MySqlBatchSink<NonNormalAvgSpeedCount> avgSpeedCounts(Connection conn, int batchSize) {
        String sql = "insert into tc_spesum (recordnum, countdate, ctdir, countlane, "
                + HourColumns.joined() + ") values (" + placeholders(4 + HourColumns.HOURS) + ")";
        return new MySqlBatchSink<>(conn, "tc_spesum", "recordnum", sql, (ps, c) -> {
            ps.setInt(1, c.key.recordNum);
            ps.setDate(2, Date.valueOf(c.key.date));
            setDirection(ps, 3, c.key.direction);
            setInteger(ps, 4, c.key.lane);
            for (int h = 0; h < HourColumns.HOURS; h++) {
                Double avg = c.hour(h);
                if (avg == null) {
                    ps.setNull(5 + h, Types.DOUBLE);
                } else {
                    ps.setDouble(5 + h, avg);
                }
            }
        }, batchSize);
    }

    static String placeholders(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('?');
        }
        return sb.toString();
    }

    static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    static void setDirection(PreparedStatement ps, int index, Direction direction) throws SQLException {
        if (direction == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, direction.dbValue());
        }
    }
}
