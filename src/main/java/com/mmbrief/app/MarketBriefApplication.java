package com.mmbrief.app;

import com.mmbrief.config.Config;
import com.mmbrief.core.RunTelemetry;
import com.mmbrief.core.StoreConnectException;
import com.mmbrief.data.YahooChartClient;
import com.mmbrief.data.YahooFundamentalsClient;
import com.mmbrief.data.http.HttpClientEx;
import com.mmbrief.db.JdbcMarketStore;
import com.mmbrief.db.StoreFactory;
import com.mmbrief.fundamentals.FundamentalsCache;
import com.mmbrief.indicator.IndicatorEngine;
import com.mmbrief.market.IndexQuote;
import com.mmbrief.market.MarketSnapshotService;
import com.mmbrief.output.IndicatorCsvWriter;
import com.mmbrief.runner.BriefingRunner;
import com.mmbrief.runner.RunSummary;
import com.mmbrief.runner.WatchlistLoader;
import com.mmbrief.signal.SignalClassifier;
import com.mmbrief.sync.HistoryRetention;
import com.mmbrief.sync.MarketDataSynchronizer;
import com.mmbrief.sync.TradingCalendar;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point: one sync-and-analyze pass over the watchlist.
 * Exit codes: 0 run completed, 1 fatal error, 2 usage or configuration error.
 */
public final class MarketBriefApplication {
    private static final Logger log = LogManager.getLogger(MarketBriefApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private final Path workingDir;

    public MarketBriefApplication() {
        this(Path.of(".").toAbsolutePath().normalize());
    }

    MarketBriefApplication(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static void main(String[] args) {
        int exit = new MarketBriefApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("mmbrief", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("mmbrief", options);
            return EXIT_OK;
        }

        Config config = Config.load(workingDir);
        installLogRoutingIfNeeded(config);

        ZoneId zone;
        try {
            zone = ZoneId.of(config.getString("calendar.zone"));
        } catch (DateTimeException e) {
            log.error("invalid calendar.zone={}", config.getString("calendar.zone"));
            return EXIT_USAGE;
        }

        boolean syncOnly = cmd.hasOption("sync-only");
        RunTelemetry telemetry = new RunTelemetry(syncOnly ? "SYNC_ONLY" : "FULL", null);

        List<String> watchlist;
        List<String> retainTickers = null;
        WatchlistLoader watchlistLoader = new WatchlistLoader(config);
        telemetry.startStep(RunTelemetry.STEP_WATCHLIST);
        try {
            String[] cliTickers = cmd.getOptionValues("ticker");
            List<String> cli = cliTickers == null ? List.of() : Arrays.asList(cliTickers);
            watchlist = watchlistLoader.load(cli);
            if (!cli.isEmpty()) {
                retainTickers = retentionTickers(watchlistLoader, watchlist);
            }
        } catch (IOException e) {
            log.error("watchlist unreadable: {}", e.getMessage());
            return EXIT_USAGE;
        }
        telemetry.endStep(RunTelemetry.STEP_WATCHLIST, watchlist.size(), watchlist.size(), 0);
        if (watchlist.isEmpty()) {
            log.error("watchlist is empty: set watchlist.tickers, provide {} or pass --ticker",
                    config.getHomePath("watchlist.path"));
            return EXIT_USAGE;
        }

        Optional<JdbcMarketStore> store;
        telemetry.startStep(RunTelemetry.STEP_STORE_OPEN);
        try {
            store = new StoreFactory(config).open(cmd.hasOption("strict-store"));
        } catch (StoreConnectException e) {
            log.error("FATAL: code={} {}", e.getErrorCode(), e.getMessage(), e);
            return EXIT_FATAL;
        }
        telemetry.endStep(RunTelemetry.STEP_STORE_OPEN, 1, store.isPresent() ? 1 : 0, 0);
        telemetry.setStoreBackend(store.map(s -> s.dialect().label()).orElse("none"));

        HttpClientEx http = new HttpClientEx(config.getInt("provider.request_timeout_sec", 20));
        YahooChartClient chartClient = new YahooChartClient(config, http);
        TradingCalendar calendar = new TradingCalendar(zone);
        Clock clock = Clock.systemUTC();
        int historyYears = config.getInt("sync.history_years", 5);

        FundamentalsCache fundamentals = null;
        if (!syncOnly) {
            fundamentals = new FundamentalsCache(config, new YahooFundamentalsClient(config, http));
            try {
                fundamentals.open();
            } catch (IOException e) {
                log.warn("fundamentals cache not loaded path={} err={}", fundamentals.file(), e.getMessage());
            }
        }

        try {
            MarketDataSynchronizer synchronizer = new MarketDataSynchronizer(
                    store.orElse(null), chartClient, calendar, clock, historyYears);
            HistoryRetention retention = store
                    .map(s -> new HistoryRetention(s, calendar, historyYears))
                    .orElse(null);
            if (!syncOnly && config.getBoolean("snapshot.enabled", true)) {
                logMarketSnapshot(new MarketSnapshotService(config, chartClient, calendar, clock), telemetry);
            }
            Path exportDir = cmd.hasOption("export-dir")
                    ? workingDir.resolve(cmd.getOptionValue("export-dir")).normalize()
                    : null;

            BriefingRunner runner = new BriefingRunner(
                    synchronizer,
                    new IndicatorEngine(),
                    new SignalClassifier(),
                    fundamentals,
                    syncOnly ? null : chartClient,
                    retention,
                    new IndicatorCsvWriter(),
                    telemetry,
                    clock
            );
            RunSummary summary = runner.run(
                    watchlist,
                    new BriefingRunner.Options(syncOnly, !cmd.hasOption("no-retention"), exportDir, retainTickers)
            );
            log.info("run summary\n{}", summary.render());
            return EXIT_OK;
        } catch (RuntimeException e) {
            log.error("FATAL: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } finally {
            if (fundamentals != null) {
                try {
                    fundamentals.flush();
                } catch (IOException e) {
                    log.warn("fundamentals cache not written path={} err={}", fundamentals.file(), e.getMessage());
                }
            }
            store.ifPresent(JdbcMarketStore::close);
            telemetry.finish();
            log.info("run telemetry\n{}", telemetry.getSummary());
        }
    }

    /**
     * With {@code --ticker} the run covers a subset, so retention keeps everything on the
     * configured watchlist as well. Without a configured watchlist the sweep is skipped.
     */
    static List<String> retentionTickers(WatchlistLoader loader, List<String> runTickers) {
        List<String> configured;
        try {
            configured = loader.load(List.of());
        } catch (IOException e) {
            log.warn("configured watchlist unreadable, retention sweep skipped err={}", e.getMessage());
            return List.of();
        }
        if (configured.isEmpty()) {
            return List.of();
        }
        List<String> keep = new ArrayList<>(configured);
        keep.addAll(runTickers);
        return WatchlistLoader.normalize(keep);
    }

    private static void logMarketSnapshot(MarketSnapshotService service, RunTelemetry telemetry) {
        telemetry.startStep(RunTelemetry.STEP_MARKET_SNAPSHOT);
        List<IndexQuote> quotes = service.snapshot();
        long available = quotes.stream().filter(q -> q.available).count();
        telemetry.endStep(RunTelemetry.STEP_MARKET_SNAPSHOT, quotes.size(), available, quotes.size() - available);
        log.info("market snapshot\n{}", MarketSnapshotService.render(quotes));
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED || !config.getBoolean("app.log_routing", true)) {
            return;
        }
        synchronized (MarketBriefApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("mmbrief.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(MarketBriefApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                log.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("ticker").hasArg().argName("symbol")
                .desc("ticker to process; repeatable, replaces the configured watchlist").build());
        options.addOption(Option.builder().longOpt("sync-only").desc("sync history only, skip indicators, signals and fundamentals").build());
        options.addOption(Option.builder().longOpt("no-retention").desc("skip the retention sweep").build());
        options.addOption(Option.builder().longOpt("strict-store").desc("fail the run when the configured store cannot be opened").build());
        options.addOption(Option.builder().longOpt("export-dir").hasArg().argName("dir").desc("write <TICKER>_indicators.csv files into dir").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
