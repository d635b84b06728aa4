package com.mmbrief.market;

import com.mmbrief.config.Config;
import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.data.MarketDataProvider;
import com.mmbrief.model.PriceSeries;
import com.mmbrief.model.RawBar;
import com.mmbrief.sync.BarNormalizer;
import com.mmbrief.sync.TradingCalendar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 模块说明：MarketSnapshotService（class）。
 * 主要职责：拉取大盘指数最近几个交易日的收盘价，给出最新价、前收与涨跌幅。
 * 使用建议：只读行情，不写入 store；单个指数失败只影响该行，不中断运行。
 */
public final class MarketSnapshotService {
    private static final Logger log = LogManager.getLogger(MarketSnapshotService.class);

    public static final List<String> DEFAULT_SYMBOLS = List.of("SPY", "QQQ", "^VIX", "^IXIC");
    static final int LOOKBACK_DAYS = 10;

    private static final Map<String, String> DISPLAY_NAMES = Map.of(
            "SPY", "S&P 500",
            "QQQ", "Nasdaq-100",
            "^VIX", "VIX",
            "^IXIC", "Nasdaq Composite"
    );

    private final MarketDataProvider provider;
    private final TradingCalendar calendar;
    private final BarNormalizer normalizer;
    private final Clock clock;
    private final List<String> symbols;

    public MarketSnapshotService(Config config, MarketDataProvider provider, TradingCalendar calendar, Clock clock) {
        this(provider, calendar, clock, config.getList("snapshot.tickers"));
    }

    public MarketSnapshotService(MarketDataProvider provider, TradingCalendar calendar, Clock clock, List<String> symbols) {
        this.provider = provider;
        this.calendar = calendar;
        this.normalizer = new BarNormalizer(calendar.zone());
        this.clock = clock;
        List<String> cleaned = new ArrayList<>();
        if (symbols != null) {
            for (String symbol : symbols) {
                if (symbol != null && !symbol.isBlank()) {
                    cleaned.add(symbol.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        this.symbols = cleaned.isEmpty() ? DEFAULT_SYMBOLS : List.copyOf(cleaned);
    }

    public List<String> symbols() {
        return symbols;
    }

    /**
     * One quote per configured symbol, in configured order.
     */
    public List<IndexQuote> snapshot() {
        LocalDate target = calendar.latestTradingDay(clock);
        LocalDate start = target.minusDays(LOOKBACK_DAYS);
        LocalDate endExclusive = target.plusDays(1);
        List<IndexQuote> out = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            out.add(quote(symbol, start, endExclusive));
        }
        return out;
    }

    private IndexQuote quote(String symbol, LocalDate start, LocalDate endExclusive) {
        String name = displayName(symbol);
        try {
            List<RawBar> rows = provider.downloadHistory(symbol, start, endExclusive);
            PriceSeries series = normalizer.normalize(symbol, rows, start, endExclusive);
            if (series.isEmpty()) {
                log.warn("market snapshot no bars symbol={}", symbol);
                return IndexQuote.unavailable(symbol, name, IndexQuote.LABEL_NO_DATA);
            }
            int n = series.size();
            double close = series.get(n - 1).close;
            double previousClose = n > 1 ? series.get(n - 2).close : close;
            double price = close;
            OptionalDouble live = provider.lastPrice(symbol);
            if (live.isPresent() && Double.isFinite(live.getAsDouble()) && live.getAsDouble() > 0.0) {
                price = live.getAsDouble();
            }
            return IndexQuote.of(symbol, name, price, previousClose, "^VIX".equals(symbol));
        } catch (ProviderFetchException e) {
            log.warn("market snapshot failed symbol={} category={} err={}", symbol, e.getCategory(), e.getMessage());
            return IndexQuote.unavailable(symbol, name, IndexQuote.LABEL_ERROR);
        } catch (RuntimeException e) {
            log.warn("market snapshot failed symbol={} err={}", symbol, e.toString(), e);
            return IndexQuote.unavailable(symbol, name, IndexQuote.LABEL_ERROR);
        }
    }

    static String displayName(String symbol) {
        return DISPLAY_NAMES.getOrDefault(symbol, symbol);
    }

    public static String render(List<IndexQuote> quotes) {
        StringBuilder sb = new StringBuilder();
        for (IndexQuote quote : quotes) {
            sb.append(String.format(Locale.ROOT, "%-18s %-7s %s%n", quote.name, quote.symbol, quote.label));
        }
        return sb.toString();
    }
}
