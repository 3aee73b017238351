package com.traffic.counts.sink;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

import com.traffic.counts.common.CountDbException;
import com.traffic.counts.common.CountMetadata;

/**
 * Updates to the {@code tc_header} row every count file belongs to.
 */
public class MySqlHeaderTable {

    private final Connection conn;

    public MySqlHeaderTable(Connection conn) {
        this.conn = conn;
    }

    public boolean exists(int recordNum) throws CountDbException {
        try (PreparedStatement ps = conn.prepareStatement("select 1 from tc_header where recordnum = ?")) {
            ps.setInt(1, recordNum);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new CountDbException("Error reading tc_header for " + recordNum + ": " + e.getMessage(), e);
        }
    }

    /**
     * Mark the count imported on {@code importDate} and store the counter and
     * speed limit from its file name.
     */
    public void updateMetadata(int recordNum, CountMetadata metadata, LocalDate importDate) throws CountDbException {
        String sql = "update tc_header set importdatadate = ?, status = 'imported', counterid = ?, speedlimit = ? "
                + "where recordnum = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setDate(1, Date.valueOf(importDate));
            ps.setInt(2, metadata.counterId);
            CountTables.setInteger(ps, 3, metadata.speedLimit);
            ps.setInt(4, recordNum);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            MySqlBatchSink.rollback(conn, e);
            throw new CountDbException("Error updating tc_header metadata for " + recordNum + ": " + e.getMessage(), e);
        }
    }

    public void updateSetDate(int recordNum, LocalDate setDate) throws CountDbException {
        try (PreparedStatement ps = conn.prepareStatement("update tc_header set setdate = ? where recordnum = ?")) {
            ps.setDate(1, Date.valueOf(setDate));
            ps.setInt(2, recordNum);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            MySqlBatchSink.rollback(conn, e);
            throw new CountDbException("Error updating tc_header setdate for " + recordNum + ": " + e.getMessage(), e);
        }
    }
}
