package com.traffic.counts.sink;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-record messages in the {@code import_log} table, shown to staff next to
 * the count. Failures here are logged and never stop an import.
 */
public class MySqlImportLog {

    private static final Logger LOG = LoggerFactory.getLogger(MySqlImportLog.class);

    public enum Level {
        DEBUG,
        INFO,
        WARNING,
        ERROR
    }

    private final Connection conn;

    public MySqlImportLog(Connection conn) {
        this.conn = conn;
    }

    public void insert(int recordNum, String message, Level level) {
        try (PreparedStatement ps = conn.prepareStatement(
                "insert into import_log (recordnum, message, log_level) values (?, ?, ?)")) {
            ps.setInt(1, recordNum);
            ps.setString(2, message);
            ps.setString(3, level.name().toLowerCase(Locale.ROOT));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            MySqlBatchSink.rollback(conn, e);
            LOG.error("Could not write import_log entry for {}: {}", recordNum, message, e);
        }
    }
}
