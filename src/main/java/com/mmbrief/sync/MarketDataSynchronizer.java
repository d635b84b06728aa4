package com.mmbrief.sync;

import com.mmbrief.core.NoDataException;
import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.core.StoreConnectException;
import com.mmbrief.core.StoreWriteException;
import com.mmbrief.data.MarketDataProvider;
import com.mmbrief.db.MarketHistoryStore;
import com.mmbrief.model.PriceSeries;
import com.mmbrief.model.RawBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 模块说明：MarketDataSynchronizer（class）。
 * 主要职责：按标的比较库内最大日期与最近交易日，只拉取缺失区间并写库，再从库中读回窗口数据。
 * 使用建议：store 为 null 或读库失败时走内存路径，整窗拉取但不落库；两次同日运行结果一致。
 */
public final class MarketDataSynchronizer {
    private static final Logger log = LogManager.getLogger(MarketDataSynchronizer.class);

    private final MarketHistoryStore store;
    private final MarketDataProvider provider;
    private final TradingCalendar calendar;
    private final BarNormalizer normalizer;
    private final Clock clock;
    private final int historyYears;

    public MarketDataSynchronizer(
            MarketHistoryStore store,
            MarketDataProvider provider,
            TradingCalendar calendar,
            Clock clock,
            int historyYears
    ) {
        this.store = store;
        this.provider = provider;
        this.calendar = calendar;
        this.normalizer = new BarNormalizer(calendar.zone());
        this.clock = clock;
        this.historyYears = Math.max(1, historyYears);
    }

    public SyncResult syncAndLoad(String ticker)
            throws ProviderFetchException, StoreWriteException, NoDataException {
        LocalDate target = calendar.latestTradingDay(clock);
        LocalDate windowStart = target.minusYears(historyYears);

        if (store == null) {
            return memoryOnly(ticker, windowStart, target);
        }

        Optional<LocalDate> maxDate;
        try {
            maxDate = store.maxDate(ticker);
        } catch (StoreConnectException e) {
            log.warn("store read failed, using memory path ticker={} err={}", ticker, e.getMessage());
            return memoryOnly(ticker, windowStart, target);
        }

        if (maxDate.isPresent() && !maxDate.get().isBefore(target)) {
            PriceSeries stored = readBack(ticker, windowStart, target);
            if (stored == null) {
                return memoryOnly(ticker, windowStart, target);
            }
            log.debug("store current ticker={} max_date={} target={}", ticker, maxDate.get(), target);
            return finish(ticker, new SyncResult(stored, SyncSource.STORE_CURRENT, 0, 0));
        }

        LocalDate start = maxDate.map(d -> d.plusDays(1)).orElse(windowStart);
        if (start.isBefore(windowStart)) {
            start = windowStart;
        }
        LocalDate endExclusive = target.plusDays(1);

        PriceSeries fetched;
        try {
            List<RawBar> rows = provider.downloadHistory(ticker, start, endExclusive);
            fetched = normalizer.normalize(ticker, rows, start, endExclusive);
        } catch (ProviderFetchException e) {
            if (maxDate.isEmpty()) {
                throw e;
            }
            log.warn("provider failed, serving stored history ticker={} max_date={} category={} err={}",
                    ticker, maxDate.get(), e.getCategory(), e.getMessage());
            PriceSeries stale = readBack(ticker, windowStart, target);
            if (stale == null) {
                throw e;
            }
            return finish(ticker, new SyncResult(stale, SyncSource.STORE_STALE, 0, 0));
        }

        int inserted = store.upsert(ticker, fetched.bars());
        log.info("sync ticker={} range=[{}, {}) fetched={} inserted={} backend={}",
                ticker, start, endExclusive, fetched.size(), inserted, store.backendName());

        PriceSeries stored = readBack(ticker, windowStart, target);
        if (stored == null) {
            return memoryOnly(ticker, windowStart, target);
        }
        return finish(ticker, new SyncResult(stored, SyncSource.INCREMENTAL, fetched.size(), inserted));
    }

    private SyncResult memoryOnly(String ticker, LocalDate windowStart, LocalDate target)
            throws ProviderFetchException, NoDataException {
        LocalDate endExclusive = target.plusDays(1);
        List<RawBar> rows = provider.downloadHistory(ticker, windowStart, endExclusive);
        PriceSeries series = normalizer.normalize(ticker, rows, windowStart, endExclusive);
        log.info("memory-only sync ticker={} range=[{}, {}) bars={}", ticker, windowStart, endExclusive, series.size());
        return finish(ticker, new SyncResult(series, SyncSource.MEMORY_ONLY, series.size(), 0));
    }

    /**
     * @return stored window, or {@code null} when the read failed
     */
    private PriceSeries readBack(String ticker, LocalDate windowStart, LocalDate target) {
        try {
            PriceSeries all = store.historySince(ticker, windowStart);
            if (all.isEmpty() || !all.lastDate().orElse(target).isAfter(target)) {
                return all;
            }
            return new PriceSeries(ticker, all.bars().stream().filter(bar -> !bar.date.isAfter(target)).toList());
        } catch (StoreConnectException e) {
            log.warn("store re-read failed ticker={} err={}", ticker, e.getMessage());
            return null;
        }
    }

    private SyncResult finish(String ticker, SyncResult result) throws NoDataException {
        if (result.series.isEmpty()) {
            throw new NoDataException(ticker);
        }
        return result;
    }
}
