package com.mmbrief.db;

import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Remote analytical store backed by PostgreSQL.
 */
public final class PostgresMarketStore extends JdbcMarketStore {
    private final PGSimpleDataSource dataSource;
    private final String jdbcUrl;
    private final String schema;

    public PostgresMarketStore(String jdbcUrl, String user, String pass, String schema, int connectTimeoutSec, boolean sqlLogEnabled) {
        super(sqlLogEnabled);
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        if (!this.jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must use PostgreSQL JDBC URL (jdbc:postgresql://...)");
        }
        this.schema = normalizeSchema(schema);

        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(this.jdbcUrl);
        if (!isBlank(user)) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setConnectTimeout(Math.max(1, connectTimeoutSec));
        pg.setApplicationName("mmbrief");
        this.dataSource = pg;
    }

    @Override
    protected Connection openConnection() throws SQLException {
        Connection raw = dataSource.getConnection();
        try (Statement st = raw.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
        } catch (SQLException e) {
            raw.close();
            throw e;
        }
        return raw;
    }

    @Override
    protected void bindDate(PreparedStatement ps, int index, LocalDate date) throws SQLException {
        ps.setObject(index, date);
    }

    @Override
    protected LocalDate readDate(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, LocalDate.class);
    }

    @Override
    public StoreDialect dialect() {
        return StoreDialect.POSTGRES;
    }

    @Override
    public String backendName() {
        return StoreDialect.POSTGRES.label();
    }

    @Override
    public String location() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out + " schema=" + schema;
    }

    private static String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "mmbrief" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
