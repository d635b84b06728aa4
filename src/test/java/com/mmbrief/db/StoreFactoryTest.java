package com.mmbrief.db;

import com.mmbrief.config.Config;
import com.mmbrief.core.StoreConnectException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoreFactoryTest {
    private static final String UNREACHABLE_PG = "jdbc:postgresql://127.0.0.1:1/mmbrief";

    @TempDir
    Path tempDir;

    @Test
    void openShouldUseLocalFileWhenNoUrlConfigured() throws Exception {
        Optional<JdbcMarketStore> store = factory(Map.of(), Map.of()).open(false);

        assertTrue(store.isPresent());
        try {
            assertEquals(StoreDialect.SQLITE, store.get().dialect());
            assertTrue(Files.exists(tempDir.resolve("home/market_history.db")));
            assertTrue(store.get().tickers().isEmpty());
        } finally {
            store.get().close();
        }
    }

    @Test
    void openShouldFallBackToLocalFileWhenRemoteIsUnreachable() throws Exception {
        Optional<JdbcMarketStore> store = factory(Map.of(), Map.of(StoreFactory.ENV_DB_URL, UNREACHABLE_PG)).open(false);

        assertTrue(store.isPresent());
        try {
            assertEquals(StoreDialect.SQLITE, store.get().dialect());
        } finally {
            store.get().close();
        }
    }

    @Test
    void strictOpenShouldFailWhenRemoteIsUnreachable() {
        StoreFactory factory = factory(Map.of("db.url", UNREACHABLE_PG), Map.of());

        StoreConnectException e = assertThrows(StoreConnectException.class, () -> factory.open(true));
        assertTrue(e.getMessage().contains("backend=postgres"));
        assertEquals("ERR-STORE-001", e.getErrorCode());
    }

    @Test
    void strictFlagInConfigShouldApplyWithoutOverride() {
        StoreFactory factory = factory(Map.of("db.url", UNREACHABLE_PG, "db.strict", "true"), Map.of());

        assertThrows(StoreConnectException.class, () -> factory.open(false));
    }

    @Test
    void invalidRemoteUrlShouldFailFast() {
        StoreFactory factory = factory(Map.of("db.url", "jdbc:mysql://localhost/x"), Map.of());

        assertThrows(StoreConnectException.class, () -> factory.open(false));
    }

    @Test
    void openShouldRunMemoryOnlyWhenNoBackendCanBeOpened() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        Map<String, String> settings = Map.of("db.local_path", blocker.resolve("sub/history.db").toString());

        assertTrue(factory(settings, Map.of()).open(false).isEmpty());
        assertThrows(StoreConnectException.class, () -> factory(settings, Map.of()).open(true));
    }

    @Test
    void schemaFailureShouldBeFatalEvenWhenNotStrict() {
        MigrationRunner failing = new MigrationRunner() {
            @Override
            public void run(JdbcMarketStore store) throws SQLException {
                throw new SQLException("disk I/O error");
            }
        };
        StoreFactory factory = new StoreFactory(config(Map.of()), Map.of(), failing);

        StoreConnectException e = assertThrows(StoreConnectException.class, () -> factory.open(false));
        assertTrue(e.getMessage().contains("schema initialization failed"));
    }

    private StoreFactory factory(Map<String, String> settings, Map<String, String> env) {
        return new StoreFactory(config(settings), env, new MigrationRunner());
    }

    private Config config(Map<String, String> settings) {
        Map<String, String> values = new HashMap<>();
        values.put("app.home", tempDir.resolve("home").toString());
        values.put("db.connect_timeout_sec", "1");
        values.putAll(settings);
        return Config.of(tempDir, values);
    }
}
