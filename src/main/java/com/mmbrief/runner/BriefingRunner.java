package com.mmbrief.runner;

import com.mmbrief.core.MarketBriefException;
import com.mmbrief.core.NoDataException;
import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.core.RunTelemetry;
import com.mmbrief.core.StoreWriteException;
import com.mmbrief.data.MarketDataProvider;
import com.mmbrief.fundamentals.FundamentalsCache;
import com.mmbrief.fundamentals.FundamentalsSnapshot;
import com.mmbrief.indicator.IndicatorEngine;
import com.mmbrief.model.IndicatorSeries;
import com.mmbrief.output.IndicatorCsvWriter;
import com.mmbrief.signal.SignalClassifier;
import com.mmbrief.signal.SignalSet;
import com.mmbrief.sync.HistoryRetention;
import com.mmbrief.sync.MarketDataSynchronizer;
import com.mmbrief.sync.SyncResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.OptionalDouble;

/**
 * 模块说明：BriefingRunner（class）。
 * 主要职责：按关注列表顺序逐只执行 同步 → 指标 → 信号 → 基本面 → 最新价，单只失败不影响其他标的。
 * 使用建议：保留清理在同步前执行一次；store 为空时保留清理自动跳过。
 */
public final class BriefingRunner {
    private static final Logger log = LogManager.getLogger(BriefingRunner.class);

    private final MarketDataSynchronizer synchronizer;
    private final IndicatorEngine indicatorEngine;
    private final SignalClassifier signalClassifier;
    private final FundamentalsCache fundamentalsCache;
    private final MarketDataProvider priceProvider;
    private final HistoryRetention retention;
    private final IndicatorCsvWriter csvWriter;
    private final RunTelemetry telemetry;
    private final Clock clock;

    public BriefingRunner(
            MarketDataSynchronizer synchronizer,
            IndicatorEngine indicatorEngine,
            SignalClassifier signalClassifier,
            FundamentalsCache fundamentalsCache,
            MarketDataProvider priceProvider,
            HistoryRetention retention,
            IndicatorCsvWriter csvWriter,
            RunTelemetry telemetry,
            Clock clock
    ) {
        this.synchronizer = synchronizer;
        this.indicatorEngine = indicatorEngine;
        this.signalClassifier = signalClassifier;
        this.fundamentalsCache = fundamentalsCache;
        this.priceProvider = priceProvider;
        this.retention = retention;
        this.csvWriter = csvWriter;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    public RunSummary run(List<String> watchlist, Options options) {
        Options opts = options == null ? Options.defaults() : options;
        RunSummary summary = new RunSummary();

        if (opts.retention && retention != null) {
            List<String> keep = opts.retainTickers == null ? watchlist : opts.retainTickers;
            if (keep.isEmpty()) {
                log.info("retention sweep skipped: no configured watchlist to retain against");
            } else {
                sweep(keep);
            }
        }

        for (String ticker : watchlist) {
            processTicker(ticker, opts, summary);
        }
        log.info("run finished tickers={} succeeded={} skipped={}",
                watchlist.size(), summary.succeededCount(), summary.skippedCount());
        return summary;
    }

    private void sweep(List<String> keep) {
        telemetry.startStep(RunTelemetry.STEP_RETENTION);
        try {
            HistoryRetention.Result result = retention.sweep(keep, clock);
            telemetry.endStep(RunTelemetry.STEP_RETENTION, result.tickersRemoved,
                    result.tickerRowsDeleted + result.expiredRowsDeleted, 0, "cutoff=" + result.cutoff);
        } catch (MarketBriefException e) {
            log.warn("retention sweep failed code={} err={}", e.getErrorCode(), e.getMessage());
            telemetry.endStep(RunTelemetry.STEP_RETENTION, 0, 0, 1, e.getErrorCode());
        }
    }

    private void processTicker(String ticker, Options opts, RunSummary summary) {
        SyncResult synced;
        telemetry.startStep(RunTelemetry.STEP_SYNC);
        try {
            synced = synchronizer.syncAndLoad(ticker);
            telemetry.addSyncRows(synced.fetchedRows, synced.insertedRows);
            telemetry.endStep(RunTelemetry.STEP_SYNC, 1, synced.series.size(), 0);
        } catch (ProviderFetchException e) {
            telemetry.endStep(RunTelemetry.STEP_SYNC, 1, 0, 0, SkipReason.PROVIDER_FETCH_FAILED.label());
            skip(summary, ticker, SkipReason.PROVIDER_FETCH_FAILED, e);
            return;
        } catch (NoDataException e) {
            telemetry.endStep(RunTelemetry.STEP_SYNC, 1, 0, 0, SkipReason.NO_DATA.label());
            skip(summary, ticker, SkipReason.NO_DATA, e);
            return;
        } catch (StoreWriteException e) {
            telemetry.endStep(RunTelemetry.STEP_SYNC, 1, 0, 0, SkipReason.STORE_WRITE_FAILED.label());
            skip(summary, ticker, SkipReason.STORE_WRITE_FAILED, e);
            return;
        } catch (RuntimeException e) {
            telemetry.endStep(RunTelemetry.STEP_SYNC, 1, 0, 0, SkipReason.ERROR.label());
            skip(summary, ticker, SkipReason.ERROR, e);
            return;
        }

        if (opts.syncOnly) {
            summary.succeeded(ticker, synced.source, synced.series.size());
            return;
        }

        try {
            summary.addAnalysis(analyze(ticker, synced, opts.exportDir));
            summary.succeeded(ticker, synced.source, synced.series.size());
        } catch (IOException | RuntimeException e) {
            skip(summary, ticker, SkipReason.ERROR, e);
        }
    }

    private TickerAnalysis analyze(String ticker, SyncResult synced, Path exportDir) throws IOException {
        telemetry.startStep(RunTelemetry.STEP_INDICATORS);
        IndicatorSeries indicators = indicatorEngine.compute(synced.series);
        telemetry.endStep(RunTelemetry.STEP_INDICATORS, synced.series.size(), indicators.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_SIGNALS);
        SignalSet signals = signalClassifier.classify(indicators);
        telemetry.endStep(RunTelemetry.STEP_SIGNALS, 1, 1, 0);

        FundamentalsSnapshot fundamentals = FundamentalsSnapshot.empty(ticker);
        if (fundamentalsCache != null) {
            telemetry.startStep(RunTelemetry.STEP_FUNDAMENTALS);
            fundamentals = fundamentalsCache.get(ticker);
            telemetry.endStep(RunTelemetry.STEP_FUNDAMENTALS, 1, fundamentals.isEmpty() ? 0 : 1, 0);
        }

        OptionalDouble lastPrice = OptionalDouble.empty();
        if (priceProvider != null) {
            telemetry.startStep(RunTelemetry.STEP_LAST_PRICE);
            try {
                lastPrice = priceProvider.lastPrice(ticker);
                telemetry.endStep(RunTelemetry.STEP_LAST_PRICE, 1, lastPrice.isPresent() ? 1 : 0, 0);
            } catch (RuntimeException e) {
                log.warn("last price unavailable ticker={} err={}", ticker, e.toString());
                telemetry.endStep(RunTelemetry.STEP_LAST_PRICE, 1, 0, 1, e.getClass().getSimpleName());
            }
        }

        if (exportDir != null && csvWriter != null) {
            telemetry.startStep(RunTelemetry.STEP_EXPORT);
            Path written = csvWriter.write(indicators, exportDir);
            telemetry.endStep(RunTelemetry.STEP_EXPORT, indicators.size(), 1, 0, written.getFileName().toString());
        }

        log.info("ticker={} source={} bars={} trend={} momentum={} volatility={}",
                ticker, synced.source.label(), indicators.size(),
                signals.trend().label(), signals.momentum().label(), signals.volatility().label());
        return new TickerAnalysis(ticker, indicators, signals, fundamentals, lastPrice,
                synced.series.changePct(), synced.source);
    }

    private void skip(RunSummary summary, String ticker, SkipReason reason, Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        if (e instanceof RuntimeException) {
            log.error("ticker skipped ticker={} reason={}", ticker, reason.label(), e);
        } else {
            log.warn("ticker skipped ticker={} reason={} err={}", ticker, reason.label(), message);
        }
        telemetry.incrementErrors(1);
        summary.skipped(ticker, reason, message);
    }

    public static final class Options {
        public final boolean syncOnly;
        public final boolean retention;
        public final Path exportDir;
        /**
         * Tickers whose history the retention sweep keeps; null means the run's watchlist.
         */
        public final List<String> retainTickers;

        public Options(boolean syncOnly, boolean retention, Path exportDir) {
            this(syncOnly, retention, exportDir, null);
        }

        public Options(boolean syncOnly, boolean retention, Path exportDir, List<String> retainTickers) {
            this.syncOnly = syncOnly;
            this.retention = retention;
            this.exportDir = exportDir;
            this.retainTickers = retainTickers == null ? null : List.copyOf(retainTickers);
        }

        public static Options defaults() {
            return new Options(false, true, null);
        }
    }
}
