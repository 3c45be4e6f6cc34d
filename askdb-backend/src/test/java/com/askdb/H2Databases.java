package com.askdb;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * In-memory H2 databases in PostgreSQL mode standing in for tenant databases.
 */
public final class H2Databases {

    private H2Databases() {
    }

    /**
     * A fresh database URL, usable as a tenant DSN.
     *
     * @param prefix readable part of the database name
     * @return jdbc url
     */
    public static String newUrl(String prefix) {
        return "jdbc:h2:mem:" + prefix + "_" + UUID.randomUUID().toString().replace("-", "")
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE";
    }

    /**
     * Run setup statements on a connection outside any pool.
     *
     * @param url jdbc url
     * @param statements DDL/DML statements
     */
    public static void execute(String url, String... statements) throws SQLException {
        try (Connection conn = DriverManager.getConnection(url);
             Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }

    /**
     * Drop the database.
     *
     * @param url jdbc url
     */
    public static void shutdown(String url) throws SQLException {
        execute(url, "SHUTDOWN");
    }
}
