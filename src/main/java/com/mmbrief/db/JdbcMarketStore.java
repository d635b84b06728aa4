package com.mmbrief.db;

import com.mmbrief.core.StoreConnectException;
import com.mmbrief.core.StoreWriteException;
import com.mmbrief.model.PriceBar;
import com.mmbrief.model.PriceSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation shared by the PostgreSQL and SQLite stores. Holds one lazily opened
 * connection for the whole run and reopens it if the driver closed it.
 */
public abstract class JdbcMarketStore implements MarketHistoryStore {
    private static final Logger log = LogManager.getLogger(JdbcMarketStore.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private static final String UPSERT_SQL = "INSERT INTO market_history(ticker, date, open, high, low, close, volume) "
            + "VALUES(?, ?, ?, ?, ?, ?, ?) ON CONFLICT(ticker, date) DO NOTHING";

    private final boolean sqlLogEnabled;
    private Connection connection;

    protected JdbcMarketStore(boolean sqlLogEnabled) {
        this.sqlLogEnabled = sqlLogEnabled;
    }

    protected abstract Connection openConnection() throws SQLException;

    protected abstract void bindDate(PreparedStatement ps, int index, LocalDate date) throws SQLException;

    protected abstract LocalDate readDate(ResultSet rs, String column) throws SQLException;

    public abstract StoreDialect dialect();

    /**
     * Human readable location with credentials masked.
     */
    public abstract String location();

    public synchronized Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            Connection raw = openConnection();
            connection = sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        }
        return connection;
    }

    @Override
    public Optional<LocalDate> maxDate(String ticker) throws StoreConnectException {
        String sql = "SELECT MAX(date) AS max_date FROM market_history WHERE ticker=?";
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            ps.setString(1, ticker);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(readDate(rs, "max_date"));
                }
            }
        } catch (SQLException e) {
            throw new StoreConnectException("max date read failed: ticker=" + ticker + ", backend=" + backendName(), e);
        }
        return Optional.empty();
    }

    @Override
    public PriceSeries historySince(String ticker, LocalDate startDate) throws StoreConnectException {
        String sql = "SELECT ticker, date, open, high, low, close, volume FROM market_history "
                + "WHERE ticker=? AND date>=? ORDER BY date ASC";
        List<PriceBar> bars = new ArrayList<>();
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            ps.setString(1, ticker);
            bindDate(ps, 2, startDate);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    bars.add(new PriceBar(
                            rs.getString("ticker"),
                            readDate(rs, "date"),
                            rs.getDouble("open"),
                            rs.getDouble("high"),
                            rs.getDouble("low"),
                            rs.getDouble("close"),
                            rs.getLong("volume")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new StoreConnectException("history read failed: ticker=" + ticker + ", backend=" + backendName(), e);
        }
        return new PriceSeries(ticker, bars);
    }

    @Override
    public int upsert(String ticker, List<PriceBar> bars) throws StoreWriteException {
        if (bars == null || bars.isEmpty()) {
            return 0;
        }
        Connection conn;
        boolean autoCommit;
        try {
            conn = connection();
            autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw new StoreWriteException("upsert failed to start: ticker=" + ticker, e);
        }
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            for (PriceBar bar : bars) {
                ps.setString(1, ticker);
                bindDate(ps, 2, bar.date);
                ps.setDouble(3, bar.open);
                ps.setDouble(4, bar.high);
                ps.setDouble(5, bar.low);
                ps.setDouble(6, bar.close);
                ps.setLong(7, bar.volume);
                ps.addBatch();
            }
            int inserted = 0;
            for (int count : ps.executeBatch()) {
                if (count > 0) {
                    inserted += count;
                }
            }
            conn.commit();
            log.debug("upsert ok ticker={} offered={} inserted={} backend={}", ticker, bars.size(), inserted, backendName());
            return inserted;
        } catch (SQLException e) {
            rollback(conn, e);
            throw new StoreWriteException("upsert rejected: ticker=" + ticker + ", rows=" + bars.size(), e);
        } finally {
            restoreAutoCommit(conn, autoCommit);
        }
    }

    @Override
    public int deleteBefore(LocalDate cutoff) throws StoreWriteException {
        try (PreparedStatement ps = connection().prepareStatement("DELETE FROM market_history WHERE date<?")) {
            bindDate(ps, 1, cutoff);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreWriteException("delete before " + cutoff + " failed", e);
        }
    }

    @Override
    public int deleteTicker(String ticker) throws StoreWriteException {
        try (PreparedStatement ps = connection().prepareStatement("DELETE FROM market_history WHERE ticker=?")) {
            ps.setString(1, ticker);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreWriteException("delete ticker failed: ticker=" + ticker, e);
        }
    }

    @Override
    public List<String> tickers() throws StoreConnectException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = connection().prepareStatement(
                "SELECT DISTINCT ticker FROM market_history ORDER BY ticker ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreConnectException("ticker list read failed: backend=" + backendName(), e);
        }
        return out;
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("store close failed backend={} err={}", backendName(), e.getMessage());
        } finally {
            connection = null;
        }
    }

    private void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            log.warn("rollback failed backend={} err={}", backendName(), rollbackError.getMessage());
        }
    }

    private void restoreAutoCommit(Connection conn, boolean autoCommit) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("restore autocommit failed backend={} err={}", backendName(), e.getMessage());
        }
    }
}
