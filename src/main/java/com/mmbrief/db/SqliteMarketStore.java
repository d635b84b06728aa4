package com.mmbrief.db;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;

/**
 * Local single-file store. Dates are ISO-8601 TEXT so lexical order is date order.
 */
public final class SqliteMarketStore extends JdbcMarketStore {
    private final Path file;

    public SqliteMarketStore(Path file, boolean sqlLogEnabled) {
        super(sqlLogEnabled);
        this.file = file.toAbsolutePath().normalize();
    }

    @Override
    protected Connection openConnection() throws SQLException {
        Path parent = file.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new SQLException("cannot create store directory: " + parent, e);
            }
        }
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + file);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout = 5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    @Override
    protected void bindDate(PreparedStatement ps, int index, LocalDate date) throws SQLException {
        ps.setString(index, date.toString());
    }

    @Override
    protected LocalDate readDate(ResultSet rs, String column) throws SQLException {
        String text = rs.getString(column);
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        return LocalDate.parse(text.trim());
    }

    @Override
    public StoreDialect dialect() {
        return StoreDialect.SQLITE;
    }

    @Override
    public String backendName() {
        return StoreDialect.SQLITE.label();
    }

    @Override
    public String location() {
        return file.toString();
    }

    public Path file() {
        return file;
    }
}
