package com.mmbrief.sync;

import com.mmbrief.core.StoreConnectException;
import com.mmbrief.core.StoreWriteException;
import com.mmbrief.db.MarketHistoryStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drops history of tickers no longer watched and rows older than the retention horizon.
 */
public final class HistoryRetention {
    private static final Logger log = LogManager.getLogger(HistoryRetention.class);

    private final MarketHistoryStore store;
    private final TradingCalendar calendar;
    private final int historyYears;

    public HistoryRetention(MarketHistoryStore store, TradingCalendar calendar, int historyYears) {
        this.store = store;
        this.calendar = calendar;
        this.historyYears = Math.max(1, historyYears);
    }

    public Result sweep(List<String> watchlist, Clock now) throws StoreConnectException, StoreWriteException {
        Set<String> keep = new HashSet<>();
        for (String ticker : watchlist) {
            keep.add(ticker.trim().toUpperCase(Locale.ROOT));
        }
        int tickersRemoved = 0;
        int tickerRows = 0;
        for (String stored : store.tickers()) {
            if (keep.contains(stored.toUpperCase(Locale.ROOT))) {
                continue;
            }
            tickerRows += store.deleteTicker(stored);
            tickersRemoved++;
        }
        LocalDate cutoff = calendar.latestTradingDay(now).minusYears(historyYears);
        int expiredRows = store.deleteBefore(cutoff);
        Result result = new Result(tickersRemoved, tickerRows, expiredRows, cutoff);
        log.info("retention sweep tickers_removed={} ticker_rows={} expired_rows={} cutoff={}",
                tickersRemoved, tickerRows, expiredRows, cutoff);
        return result;
    }

    public static final class Result {
        public final int tickersRemoved;
        public final int tickerRowsDeleted;
        public final int expiredRowsDeleted;
        public final LocalDate cutoff;

        public Result(int tickersRemoved, int tickerRowsDeleted, int expiredRowsDeleted, LocalDate cutoff) {
            this.tickersRemoved = tickersRemoved;
            this.tickerRowsDeleted = tickerRowsDeleted;
            this.expiredRowsDeleted = expiredRowsDeleted;
            this.cutoff = cutoff;
        }
    }
}
