package com.traffic.counts.sink;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

import com.traffic.counts.common.JsonUtils;

public final class MySqlConnections {

    private MySqlConnections() {
    }

    /**
     * Open a connection with auto-commit off; writers commit themselves.
     */
    public static Connection open(Properties props) throws SQLException {
        String url = JsonUtils.requireProperty(props, "mysql.url");
        String user = JsonUtils.requireProperty(props, "mysql.user");
        String password = JsonUtils.requireProperty(props, "mysql.password");
        try {
            // register the driver explicitly when running from a shaded jar
            Class.forName("com.mysql.cj.jdbc.Driver");
        } catch (ClassNotFoundException e) {
            throw new SQLException("MySQL JDBC driver not on classpath", e);
        }
        Connection conn = DriverManager.getConnection(url, user, password);
        conn.setAutoCommit(false);
        return conn;
    }
}
