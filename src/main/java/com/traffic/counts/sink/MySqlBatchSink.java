package com.traffic.counts.sink;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import com.traffic.counts.common.CountDbException;

/**
 * Replaces all rows of one record in a count table: delete by record number,
 * batch insert, one commit.
 */
public class MySqlBatchSink<T> {

    /**
     * Binds one row to the insert statement.
     */
    @FunctionalInterface
    public interface RowBinder<T> {
        void bind(PreparedStatement ps, T row) throws SQLException;
    }

    private final Connection conn;
    private final String table;
    private final String deleteSql;
    private final String insertSql;
    private final RowBinder<T> binder;
    private final int batchSize;

    public MySqlBatchSink(Connection conn, String table, String recordNumField, String insertSql,
                          RowBinder<T> binder, int batchSize) {
        this.conn = conn;
        this.table = table;
        this.deleteSql = "delete from " + table + " where " + recordNumField + " = ?";
        this.insertSql = insertSql;
        this.binder = binder;
        this.batchSize = batchSize;
    }

    public void replace(int recordNum, List<T> rows) throws CountDbException {
        try (PreparedStatement delete = conn.prepareStatement(deleteSql);
             PreparedStatement ps = conn.prepareStatement(insertSql)) {
            delete.setInt(1, recordNum);
            delete.executeUpdate();

            List<T> buffer = new ArrayList<>(batchSize);
            for (T row : rows) {
                buffer.add(row);
                if (buffer.size() >= batchSize) {
                    flush(ps, buffer);
                }
            }
            flush(ps, buffer);
            conn.commit();
        } catch (SQLException e) {
            rollback(conn, e);
            throw new CountDbException("Error replacing " + table + " rows for " + recordNum + ": " + e.getMessage(), e);
        }
    }

    private void flush(PreparedStatement ps, List<T> buffer) throws SQLException {
        if (buffer.isEmpty()) {
            return;
        }
        try {
            for (T row : buffer) {
                binder.bind(ps, row);
                ps.addBatch();
            }
            ps.executeBatch();
        } finally {
            ps.clearBatch();
            buffer.clear();
        }
    }

    /**
     * Roll back after {@code cause}; a failing rollback is attached to it.
     */
    static void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
