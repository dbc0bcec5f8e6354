package com.drawpool.store;

import com.drawpool.config.DrawPoolConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens JDBC connections to the drawpool database. Leaves the JVM default time zone alone;
 * {@link JdbcJobStore} converts every timestamp through an explicit UTC calendar instead.
 */
public class JdbcConnectionProvider {

    private final DrawPoolConfig config;

    public JdbcConnectionProvider(DrawPoolConfig config) {
        this.config = Objects.requireNonNull(config, "DrawPoolConfig");
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName();
    }

    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl(), config.getDbUser(), config.getDbPassword());
    }
}
