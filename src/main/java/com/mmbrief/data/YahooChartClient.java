package com.mmbrief.data;

import com.mmbrief.config.Config;
import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.data.http.HttpClientEx;
import com.mmbrief.model.RawBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 模块说明：YahooChartClient（class）。
 * 主要职责：调用 Yahoo chart 接口按区间拉取日线，带线性退避重试与请求间隔限流。
 * 使用建议：区间为 [start, end) 左闭右开；返回原始行，由同步器统一做归一化。
 */
public class YahooChartClient implements MarketDataProvider {
    private static final Logger log = LogManager.getLogger(YahooChartClient.class);

    private final HttpClientEx http;
    private final String chartUrl;
    private final int timeoutSec;
    private final int retryCount;
    private final long retrySleepMs;
    private final long requestPauseMs;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);

    public YahooChartClient(Config config, HttpClientEx http) {
        this.http = http;
        this.chartUrl = config.getString("provider.chart_url", "https://query1.finance.yahoo.com/v8/finance/chart/%s");
        this.timeoutSec = Math.max(3, config.getInt("provider.request_timeout_sec", 20));
        this.retryCount = Math.max(0, config.getInt("provider.retry_count", 2));
        this.retrySleepMs = Math.max(0L, config.getLong("provider.retry_sleep_ms", 700L));
        this.requestPauseMs = Math.max(0L, config.getLong("provider.request_pause_ms", 0L));
    }

    @Override
    public List<RawBar> downloadHistory(String ticker, LocalDate startInclusive, LocalDate endExclusive)
            throws ProviderFetchException {
        if (!startInclusive.isBefore(endExclusive)) {
            return List.of();
        }
        String url = String.format(chartUrl, encode(ticker))
                + "?period1=" + startInclusive.atStartOfDay(ZoneOffset.UTC).toEpochSecond()
                + "&period2=" + endExclusive.atStartOfDay(ZoneOffset.UTC).toEpochSecond()
                + "&interval=1d&events=history&includeAdjustedClose=true";
        String body = fetchWithRetry(ticker, url);
        if (body == null) {
            return List.of();
        }
        List<RawBar> rows = parseChart(ticker, body);
        log.debug("chart fetched ticker={} start={} end={} rows={}", ticker, startInclusive, endExclusive, rows.size());
        return rows;
    }

    @Override
    public OptionalDouble lastPrice(String ticker) {
        String url = String.format(chartUrl, encode(ticker)) + "?range=1d&interval=1d";
        try {
            String body = fetchWithRetry(ticker, url);
            if (body == null) {
                return OptionalDouble.empty();
            }
            return parseRegularMarketPrice(ticker, body);
        } catch (ProviderFetchException e) {
            log.warn("last price unavailable ticker={} category={} err={}", ticker, e.getCategory(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    /**
     * @return response body, or {@code null} when the provider reports the symbol as unknown
     */
    private String fetchWithRetry(String ticker, String url) throws ProviderFetchException {
        ProviderFetchException last = null;
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            try {
                throttleRequest(requestPauseMs);
                HttpClientEx.Response resp = http.get(url, timeoutSec);
                if (resp.isSuccess()) {
                    return resp.body;
                }
                if (resp.status == 404) {
                    log.warn("chart symbol not found ticker={}", ticker);
                    return null;
                }
                boolean retryable = resp.status == 429 || resp.status >= 500;
                last = new ProviderFetchException(
                        "chart http status=" + resp.status + " ticker=" + ticker,
                        resp.status == 429 ? "rate_limit" : "http_status",
                        retryable
                );
            } catch (IOException e) {
                last = new ProviderFetchException(
                        "chart request failed ticker=" + ticker + " err=" + e.getMessage(),
                        classifyFailureMessage(e.getMessage()),
                        true,
                        e
                );
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderFetchException("chart fetch interrupted ticker=" + ticker, "interrupted", false, e);
            }
            if (attempt >= retryCount || !last.isRetryable()) {
                break;
            }
            log.info("chart retry ticker={} attempt={} category={}", ticker, attempt + 1, last.getCategory());
            try {
                sleep(retrySleepMs * (attempt + 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderFetchException("chart fetch interrupted ticker=" + ticker, "interrupted", false, e);
            }
        }
        throw last;
    }

    /**
     * Parses a chart payload into raw rows. Null cells become NaN (volume 0); the
     * normalizer drops rows whose close is not usable.
     */
    public static List<RawBar> parseChart(String ticker, String body) throws ProviderFetchException {
        JSONObject r0 = firstResult(ticker, body);
        if (r0 == null) {
            return List.of();
        }
        ZoneId zone = exchangeZone(r0.optJSONObject("meta"));
        JSONArray timestamps = r0.optJSONArray("timestamp");
        JSONObject indicators = r0.optJSONObject("indicators");
        JSONArray quoteArr = indicators == null ? null : indicators.optJSONArray("quote");
        JSONObject quote0 = (quoteArr == null || quoteArr.length() == 0) ? null : quoteArr.optJSONObject(0);
        if (timestamps == null || quote0 == null) {
            return List.of();
        }
        JSONArray adjArr = indicators.optJSONArray("adjclose");
        JSONObject adj0 = (adjArr == null || adjArr.length() == 0) ? null : adjArr.optJSONObject(0);

        JSONArray opens = quote0.optJSONArray("open");
        JSONArray highs = quote0.optJSONArray("high");
        JSONArray lows = quote0.optJSONArray("low");
        JSONArray closes = quote0.optJSONArray("close");
        JSONArray volumes = quote0.optJSONArray("volume");
        JSONArray adjCloses = adj0 == null ? null : adj0.optJSONArray("adjclose");

        List<RawBar> out = new ArrayList<>(timestamps.length());
        for (int i = 0; i < timestamps.length(); i++) {
            long epoch = timestamps.optLong(i, 0L);
            if (epoch <= 0L) {
                continue;
            }
            double volume = valueAt(volumes, i);
            out.add(new RawBar(
                    Instant.ofEpochSecond(epoch),
                    zone,
                    valueAt(opens, i),
                    valueAt(highs, i),
                    valueAt(lows, i),
                    valueAt(closes, i),
                    valueAt(adjCloses, i),
                    Double.isFinite(volume) && volume > 0.0 ? (long) volume : 0L
            ));
        }
        return out;
    }

    public static OptionalDouble parseRegularMarketPrice(String ticker, String body) throws ProviderFetchException {
        JSONObject r0 = firstResult(ticker, body);
        JSONObject meta = r0 == null ? null : r0.optJSONObject("meta");
        if (meta == null) {
            return OptionalDouble.empty();
        }
        double price = meta.optDouble("regularMarketPrice", Double.NaN);
        if (!Double.isFinite(price) || price <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(price);
    }

    private static JSONObject firstResult(String ticker, String body) throws ProviderFetchException {
        try {
            JSONObject root = new JSONObject(body);
            JSONObject chart = root.optJSONObject("chart");
            if (chart == null) {
                throw new ProviderFetchException("chart payload missing 'chart' ticker=" + ticker, "payload", false);
            }
            JSONObject error = chart.optJSONObject("error");
            if (error != null) {
                log.warn("chart error ticker={} code={} description={}",
                        ticker, error.optString("code"), error.optString("description"));
                return null;
            }
            JSONArray result = chart.optJSONArray("result");
            if (result == null || result.length() == 0) {
                return null;
            }
            return result.optJSONObject(0);
        } catch (JSONException e) {
            throw new ProviderFetchException("chart payload unparseable ticker=" + ticker, "payload", false, e);
        }
    }

    private static ZoneId exchangeZone(JSONObject meta) {
        String name = meta == null ? "" : meta.optString("exchangeTimezoneName", "");
        if (name.isEmpty()) {
            return null;
        }
        try {
            return ZoneId.of(name);
        } catch (DateTimeException e) {
            log.warn("unknown exchange zone={}, using calendar zone", name);
            return null;
        }
    }

    private static double valueAt(JSONArray arr, int index) {
        if (arr == null || index < 0 || index >= arr.length() || arr.isNull(index)) {
            return Double.NaN;
        }
        return arr.optDouble(index, Double.NaN);
    }

    public static String classifyFailureMessage(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return "timeout";
        }
        return "network";
    }

    protected void sleep(long millis) throws InterruptedException {
        if (millis > 0L) {
            TimeUnit.MILLISECONDS.sleep(millis);
        }
    }

    private void throttleRequest(long pauseMs) throws InterruptedException {
        if (pauseMs <= 0L) {
            return;
        }
        long pauseNanos = pauseMs * 1_000_000L;
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev + pauseNanos;
            if (prev != 0L && now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }

    private static String encode(String ticker) {
        return URLEncoder.encode(ticker.trim().toUpperCase(Locale.ROOT), StandardCharsets.UTF_8);
    }
}
