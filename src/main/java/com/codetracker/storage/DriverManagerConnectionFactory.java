package com.codetracker.storage;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

public class DriverManagerConnectionFactory implements ConnectionFactory {

    private final String url;

    public DriverManagerConnectionFactory(String url) {
        this.url = Objects.requireNonNull(url, "url");
    }

    @Override
    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url);
    }

    public String url() {
        return url;
    }
}
