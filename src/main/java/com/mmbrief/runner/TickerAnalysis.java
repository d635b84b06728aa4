package com.mmbrief.runner;

import com.mmbrief.fundamentals.FundamentalsSnapshot;
import com.mmbrief.model.IndicatorSeries;
import com.mmbrief.signal.SignalSet;
import com.mmbrief.sync.SyncSource;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Everything downstream consumers get for one ticker.
 */
public final class TickerAnalysis {
    public final String ticker;
    public final IndicatorSeries indicators;
    public final SignalSet signals;
    public final FundamentalsSnapshot fundamentals;
    public final OptionalDouble lastPrice;
    public final OptionalDouble changePct;
    public final SyncSource syncSource;

    public TickerAnalysis(
            String ticker,
            IndicatorSeries indicators,
            SignalSet signals,
            FundamentalsSnapshot fundamentals,
            OptionalDouble lastPrice,
            OptionalDouble changePct,
            SyncSource syncSource
    ) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.indicators = Objects.requireNonNull(indicators, "indicators");
        this.signals = signals == null ? SignalSet.unknown() : signals;
        this.fundamentals = fundamentals == null ? FundamentalsSnapshot.empty(ticker) : fundamentals;
        this.lastPrice = lastPrice == null ? OptionalDouble.empty() : lastPrice;
        this.changePct = changePct == null ? OptionalDouble.empty() : changePct;
        this.syncSource = Objects.requireNonNull(syncSource, "syncSource");
    }
}
