package com.mmbrief.db;

import com.mmbrief.config.Config;
import com.mmbrief.core.StoreConnectException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the store backend for a run: PostgreSQL when a URL is configured, otherwise (or on
 * failure) the local SQLite file. Strict mode turns any connection failure into a fatal
 * {@link StoreConnectException}; without it the run may continue with no store at all.
 */
public final class StoreFactory {
    private static final Logger log = LogManager.getLogger(StoreFactory.class);

    public static final String ENV_DB_URL = "MMBRIEF_DB_URL";
    public static final String ENV_DB_USER = "MMBRIEF_DB_USER";
    public static final String ENV_DB_PASS = "MMBRIEF_DB_PASS";

    private final Config config;
    private final Map<String, String> env;
    private final MigrationRunner migrationRunner;

    public StoreFactory(Config config) {
        this(config, System.getenv(), new MigrationRunner());
    }

    public StoreFactory(Config config, Map<String, String> env, MigrationRunner migrationRunner) {
        this.config = config;
        this.env = env == null ? Map.of() : env;
        this.migrationRunner = migrationRunner;
    }

    public Optional<JdbcMarketStore> open(boolean strictOverride) throws StoreConnectException {
        boolean strict = strictOverride || config.getBoolean("db.strict", false);
        boolean sqlLog = config.getBoolean("db.sql_log.enabled", false);
        String url = setting(ENV_DB_URL, "db.url");

        if (!url.isEmpty()) {
            JdbcMarketStore remote;
            try {
                remote = new PostgresMarketStore(
                        url,
                        setting(ENV_DB_USER, "db.user"),
                        setting(ENV_DB_PASS, "db.pass"),
                        config.getString("db.schema"),
                        config.getInt("db.connect_timeout_sec", 10),
                        sqlLog
                );
            } catch (IllegalArgumentException e) {
                throw new StoreConnectException("invalid remote store settings: " + e.getMessage(), e);
            }
            Optional<JdbcMarketStore> opened = tryConnect(remote, strict);
            if (opened.isPresent()) {
                return Optional.of(migrate(opened.get()));
            }
            log.warn("remote store unavailable, falling back to local file url={}", remote.location());
        }

        Path localPath = config.getHomePath("db.local_path");
        Optional<JdbcMarketStore> local = tryConnect(new SqliteMarketStore(localPath, sqlLog), strict);
        if (local.isPresent()) {
            return Optional.of(migrate(local.get()));
        }
        log.warn("no store available, running memory-only");
        return Optional.empty();
    }

    private Optional<JdbcMarketStore> tryConnect(JdbcMarketStore store, boolean strict) throws StoreConnectException {
        try {
            store.connection();
            log.info("store connected backend={} location={}", store.backendName(), store.location());
            return Optional.of(store);
        } catch (SQLException e) {
            store.close();
            String detail = "store connect failed: backend=" + store.backendName()
                    + ", location=" + store.location()
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + e.getMessage();
            if (strict) {
                throw new StoreConnectException(detail, e);
            }
            log.warn(detail);
            return Optional.empty();
        }
    }

    private JdbcMarketStore migrate(JdbcMarketStore store) throws StoreConnectException {
        try {
            migrationRunner.run(store);
            return store;
        } catch (SQLException e) {
            store.close();
            throw new StoreConnectException("schema initialization failed: backend=" + store.backendName(), e);
        }
    }

    private String setting(String envKey, String configKey) {
        String fromEnv = env.get(envKey);
        if (fromEnv != null && !fromEnv.trim().isEmpty()) {
            return fromEnv.trim();
        }
        return config.getString(configKey);
    }

    private static String classifyConnectFailure(SQLException e) {
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase();
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked")) {
            return "locked";
        }
        if (msg.contains("authentication") || msg.contains("password")) {
            return "auth";
        }
        if (msg.contains("no such file") || msg.contains("cannot open") || msg.contains("does not exist")) {
            return "missing_dir";
        }
        return "connection_error";
    }
}
