package com.flowline.coordinator.bus;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens the dedicated connection the bus LISTENs on.
 *
 * Not a pooled connection: it stays open for the life of the bus and
 * carries session-level LISTEN state, which must never reach a pooled
 * connection.
 */
@FunctionalInterface
public interface ListenConnectionFactory {

    Connection open() throws SQLException;

    static ListenConnectionFactory driverManager(String url, String username, String password,
                                                 String applicationName) {
        return () -> {
            Properties props = new Properties();
            if (username != null) props.setProperty("user", username);
            if (password != null) props.setProperty("password", password);
            props.setProperty("ApplicationName", applicationName);
            return DriverManager.getConnection(url, props);
        };
    }
}
