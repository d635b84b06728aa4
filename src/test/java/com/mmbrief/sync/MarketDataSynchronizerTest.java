package com.mmbrief.sync;

import com.mmbrief.core.NoDataException;
import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.core.StoreConnectException;
import com.mmbrief.core.StoreWriteException;
import com.mmbrief.data.SyntheticProvider;
import com.mmbrief.db.MarketHistoryStore;
import com.mmbrief.db.MigrationRunner;
import com.mmbrief.db.SqliteMarketStore;
import com.mmbrief.model.PriceBar;
import com.mmbrief.model.PriceSeries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketDataSynchronizerTest {
    // Friday 2024-06-14, 17:00 in New York
    private static final Clock FRIDAY = Clock.fixed(Instant.parse("2024-06-14T21:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TARGET = LocalDate.of(2024, 6, 14);
    private static final LocalDate WINDOW_START = LocalDate.of(2019, 6, 14);

    @TempDir
    Path tempDir;

    private SqliteMarketStore store;
    private SyntheticProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqliteMarketStore(tempDir.resolve("history.db"), false);
        new MigrationRunner().run(store);
        provider = new SyntheticProvider();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void syncShouldFetchFullWindowIntoEmptyStore() throws Exception {
        SyncResult result = synchronizer(store, FRIDAY).syncAndLoad("AAPL");

        assertEquals(SyncSource.INCREMENTAL, result.source);
        assertEquals(1, provider.calls.size());
        assertEquals(WINDOW_START, provider.calls.get(0)[0]);
        assertEquals(TARGET.plusDays(1), provider.calls.get(0)[1]);
        assertEquals(result.fetchedRows, result.insertedRows);
        assertEquals(result.fetchedRows, result.series.size());
        assertEquals(WINDOW_START, result.series.get(0).date);
        assertEquals(TARGET, result.series.lastDate().orElseThrow());
    }

    @Test
    void syncShouldFetchOnlyTheGapAfterStoredMaxDate() throws Exception {
        List<PriceBar> preloaded = SyntheticProvider.weekdayBars("AAPL", WINDOW_START, LocalDate.of(2024, 6, 7));
        store.upsert("AAPL", preloaded);

        SyncResult result = synchronizer(store, FRIDAY).syncAndLoad("AAPL");

        assertEquals(SyncSource.INCREMENTAL, result.source);
        assertEquals(LocalDate.of(2024, 6, 8), provider.calls.get(0)[0]);
        assertEquals(LocalDate.of(2024, 6, 15), provider.calls.get(0)[1]);
        assertEquals(5, result.fetchedRows);
        assertEquals(5, result.insertedRows);
        assertEquals(preloaded.size() + 5, result.series.size());
        assertEquals(TARGET, result.series.lastDate().orElseThrow());
    }

    @Test
    void secondSyncOnSameDayShouldNotCallProviderAndReturnSameSeries() throws Exception {
        MarketDataSynchronizer synchronizer = synchronizer(store, FRIDAY);
        SyncResult first = synchronizer.syncAndLoad("AAPL");
        SyncResult second = synchronizer.syncAndLoad("AAPL");

        assertEquals(SyncSource.STORE_CURRENT, second.source);
        assertEquals(1, provider.calls.size());
        assertEquals(0, second.fetchedRows);
        assertEquals(0, second.insertedRows);
        assertEquals(first.series, second.series);
    }

    @Test
    void syncOnWeekendShouldTreatFridayAsCurrent() throws Exception {
        synchronizer(store, FRIDAY).syncAndLoad("AAPL");
        Clock sunday = Clock.fixed(Instant.parse("2024-06-16T15:00:00Z"), ZoneOffset.UTC);

        SyncResult result = synchronizer(store, sunday).syncAndLoad("AAPL");

        assertEquals(SyncSource.STORE_CURRENT, result.source);
        assertEquals(1, provider.calls.size());
    }

    @Test
    void syncOnNextTradingDayShouldAppendOneBar() throws Exception {
        SyncResult friday = synchronizer(store, FRIDAY).syncAndLoad("AAPL");
        Clock monday = Clock.fixed(Instant.parse("2024-06-17T21:00:00Z"), ZoneOffset.UTC);

        SyncResult result = synchronizer(store, monday).syncAndLoad("AAPL");

        assertEquals(SyncSource.INCREMENTAL, result.source);
        assertEquals(LocalDate.of(2024, 6, 15), provider.calls.get(1)[0]);
        assertEquals(LocalDate.of(2024, 6, 18), provider.calls.get(1)[1]);
        assertEquals(1, result.insertedRows);
        assertEquals(LocalDate.of(2024, 6, 17), result.series.lastDate().orElseThrow());
        // window start moved by three days, Friday 2019-06-14 dropped out of the read
        assertEquals(LocalDate.of(2019, 6, 17), result.series.get(0).date);
        assertEquals(friday.series.size(), result.series.size());
    }

    @Test
    void syncWithoutStoreShouldFetchWholeWindowInMemory() throws Exception {
        SyncResult result = synchronizer(null, FRIDAY).syncAndLoad("AAPL");

        assertEquals(SyncSource.MEMORY_ONLY, result.source);
        assertEquals(WINDOW_START, provider.calls.get(0)[0]);
        assertEquals(result.series.size(), result.fetchedRows);
        assertEquals(0, result.insertedRows);
        assertEquals(TARGET, result.series.lastDate().orElseThrow());
    }

    @Test
    void syncShouldFallBackToMemoryWhenStoreReadFails() throws Exception {
        SyncResult result = synchronizer(new UnreadableStore(), FRIDAY).syncAndLoad("AAPL");

        assertEquals(SyncSource.MEMORY_ONLY, result.source);
        assertTrue(result.series.size() > 1000);
    }

    @Test
    void syncShouldServeStoredRowsWhenProviderFails() throws Exception {
        store.upsert("AAPL", SyntheticProvider.weekdayBars("AAPL", WINDOW_START, LocalDate.of(2024, 6, 7)));
        provider.failing.add("AAPL");

        SyncResult result = synchronizer(store, FRIDAY).syncAndLoad("AAPL");

        assertEquals(SyncSource.STORE_STALE, result.source);
        assertEquals(LocalDate.of(2024, 6, 7), result.series.lastDate().orElseThrow());
        assertEquals(0, result.insertedRows);
    }

    @Test
    void syncShouldPropagateProviderFailureWhenNothingIsStored() {
        provider.failing.add("AAPL");

        assertThrows(ProviderFetchException.class, () -> synchronizer(store, FRIDAY).syncAndLoad("AAPL"));
        assertTrue(storeIsEmpty());
    }

    @Test
    void syncShouldRaiseNoDataWhenProviderReturnsNothing() {
        provider.empty.add("ZZZZ");

        assertThrows(NoDataException.class, () -> synchronizer(store, FRIDAY).syncAndLoad("ZZZZ"));
        assertThrows(NoDataException.class, () -> synchronizer(null, FRIDAY).syncAndLoad("ZZZZ"));
    }

    private boolean storeIsEmpty() {
        try {
            return store.tickers().isEmpty();
        } catch (StoreConnectException e) {
            throw new IllegalStateException(e);
        }
    }

    private MarketDataSynchronizer synchronizer(MarketHistoryStore target, Clock clock) {
        return new MarketDataSynchronizer(target, provider, new TradingCalendar(), clock, 5);
    }

    private static final class UnreadableStore implements MarketHistoryStore {
        @Override
        public Optional<LocalDate> maxDate(String ticker) throws StoreConnectException {
            throw new StoreConnectException("connection refused");
        }

        @Override
        public PriceSeries historySince(String ticker, LocalDate startDate) throws StoreConnectException {
            throw new StoreConnectException("connection refused");
        }

        @Override
        public int upsert(String ticker, List<PriceBar> bars) throws StoreWriteException {
            throw new StoreWriteException("connection refused", new SQLException("closed"));
        }

        @Override
        public int deleteBefore(LocalDate cutoff) {
            return 0;
        }

        @Override
        public int deleteTicker(String ticker) {
            return 0;
        }

        @Override
        public List<String> tickers() {
            return List.of();
        }

        @Override
        public String backendName() {
            return "broken";
        }

        @Override
        public void close() {
        }
    }
}
