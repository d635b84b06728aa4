package com.mmbrief.data;

import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.model.RawBar;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Upstream source of daily bars.
 */
public interface MarketDataProvider {

    /**
     * Daily rows for {@code [startInclusive, endExclusive)}. Rows are returned as the
     * provider reports them; callers normalize.
     */
    List<RawBar> downloadHistory(String ticker, LocalDate startInclusive, LocalDate endExclusive)
            throws ProviderFetchException;

    /**
     * Most recent traded price, or empty when the provider cannot supply one.
     */
    OptionalDouble lastPrice(String ticker);
}
