package com.traffic.counts.sink;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.Map;

import com.traffic.counts.aadv.AadvResult;
import com.traffic.counts.aadv.AadvStore;
import com.traffic.counts.common.CountDbException;
import com.traffic.counts.common.Direction;

/**
 * Writes AADV values to {@code tc_aadv} and the overall value to
 * {@code tc_header.aadv}, rounded to whole vehicles.
 */
public class MySqlAadvStore implements AadvStore {

    private static final String DELETE_SQL = "delete from tc_aadv where recordnum = ? and date_calculated = ?";
    private static final String INSERT_SQL =
            "insert into tc_aadv (recordnum, aadv, direction, date_calculated) values (?, ?, ?, ?)";
    private static final String HEADER_SQL = "update tc_header set aadv = ? where recordnum = ?";

    private final Connection conn;

    public MySqlAadvStore(Connection conn) {
        this.conn = conn;
    }

    @Override
    public void replaceAadv(int recordNum, AadvResult result, LocalDate calculated) throws CountDbException {
        Date day = Date.valueOf(calculated);
        try (PreparedStatement delete = conn.prepareStatement(DELETE_SQL);
             PreparedStatement insert = conn.prepareStatement(INSERT_SQL);
             PreparedStatement header = conn.prepareStatement(HEADER_SQL)) {
            delete.setInt(1, recordNum);
            delete.setDate(2, day);
            delete.executeUpdate();

            if (result.overall() != null) {
                bind(insert, recordNum, result.overall(), null, day);
                insert.addBatch();
            }
            for (Map.Entry<Direction, Double> e : result.byDirection().entrySet()) {
                bind(insert, recordNum, e.getValue(), e.getKey(), day);
                insert.addBatch();
            }
            insert.executeBatch();

            if (result.overall() != null) {
                header.setLong(1, Math.round(result.overall()));
                header.setInt(2, recordNum);
                header.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            MySqlBatchSink.rollback(conn, e);
            throw new CountDbException("Error storing AADV for " + recordNum + ": " + e.getMessage(), e);
        }
    }

    private static void bind(PreparedStatement ps, int recordNum, double aadv, Direction direction, Date day)
            throws SQLException {
        ps.setInt(1, recordNum);
        ps.setLong(2, Math.round(aadv));
        if (direction == null) {
            ps.setNull(3, Types.VARCHAR);
        } else {
            ps.setString(3, direction.dbValue());
        }
        ps.setDate(4, day);
    }
}
