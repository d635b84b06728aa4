package com.mmbrief.db;

import com.mmbrief.core.StoreConnectException;
import com.mmbrief.core.StoreWriteException;
import com.mmbrief.model.PriceBar;
import com.mmbrief.model.PriceSeries;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable {@code (ticker, date) -> OHLCV} history. Stored rows are never overwritten.
 */
public interface MarketHistoryStore extends AutoCloseable {

    Optional<LocalDate> maxDate(String ticker) throws StoreConnectException;

    /**
     * Rows with {@code date >= startDate}, ascending. Empty series when nothing is stored.
     */
    PriceSeries historySince(String ticker, LocalDate startDate) throws StoreConnectException;

    /**
     * Insert-or-ignore on {@code (ticker, date)} in a single transaction.
     *
     * @return number of rows actually inserted
     */
    int upsert(String ticker, List<PriceBar> bars) throws StoreWriteException;

    int deleteBefore(LocalDate cutoff) throws StoreWriteException;

    int deleteTicker(String ticker) throws StoreWriteException;

    List<String> tickers() throws StoreConnectException;

    String backendName();

    @Override
    void close();
}
