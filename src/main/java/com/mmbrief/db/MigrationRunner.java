package com.mmbrief.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent schema creation for both store dialects.
 */
public class MigrationRunner {
    private static final Logger log = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(JdbcMarketStore store) throws SQLException {
        Connection conn = store.connection();
        List<String> sqls = buildStatements(store.dialect());
        String lastSql = "";
        int currentVersion = 0;
        try (Statement st = conn.createStatement()) {
            for (String sql : sqls) {
                lastSql = sql;
                st.execute(sql);
            }
            currentVersion = readSchemaVersion(conn);
            if (currentVersion < TARGET_VERSION) {
                lastSql = "write schema_version";
                writeSchemaVersion(conn, TARGET_VERSION);
            }
        } catch (SQLException e) {
            String detail = "migration_failed: backend=" + store.backendName()
                    + ", schema_version=" + currentVersion
                    + ", target_version=" + TARGET_VERSION
                    + ", failed_sql=" + summarizeSql(lastSql)
                    + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
            log.error(detail);
            throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
        }
        log.info("schema ready backend={} version={}", store.backendName(), Math.max(currentVersion, TARGET_VERSION));
    }

    private List<String> buildStatements(StoreDialect dialect) {
        boolean pg = dialect == StoreDialect.POSTGRES;
        String real = pg ? "DOUBLE PRECISION" : "REAL";
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS metadata (" +
                "meta_key TEXT PRIMARY KEY," +
                "meta_value TEXT NOT NULL," +
                (pg ? "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" : "updated_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP") +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS market_history (" +
                "ticker TEXT NOT NULL," +
                (pg ? "date DATE NOT NULL," : "date TEXT NOT NULL,") +
                "open " + real + "," +
                "high " + real + "," +
                "low " + real + "," +
                "close " + real + " NOT NULL," +
                "volume BIGINT," +
                "PRIMARY KEY (ticker, date)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS news_items (" +
                (pg ? "id BIGSERIAL PRIMARY KEY," : "id INTEGER PRIMARY KEY AUTOINCREMENT,") +
                "ticker TEXT NOT NULL," +
                "title TEXT NOT NULL," +
                "publisher TEXT NULL," +
                "link TEXT NULL," +
                "provider_publish_time BIGINT NULL," +
                "created_at BIGINT NOT NULL," +
                "UNIQUE (ticker, title)" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_market_history_date ON market_history(date)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_news_items_ticker_time ON news_items(ticker, provider_publish_time)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && value.trim().matches("\\d+")) {
                    return Integer.parseInt(value.trim());
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, CURRENT_TIMESTAMP) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }
}
