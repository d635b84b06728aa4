package com.mmbrief.data;

import com.mmbrief.config.Config;
import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.data.http.HttpClientEx;
import com.mmbrief.model.PriceSeries;
import com.mmbrief.model.RawBar;
import com.mmbrief.sync.BarNormalizer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YahooChartClientTest {

    @Test
    void parseChartShouldReadRowsAndExchangeZone() throws Exception {
        List<RawBar> rows = YahooChartClient.parseChart("AAPL", fixture("/yahoo/chart_aapl.json"));

        assertEquals(5, rows.size());
        assertEquals(ZoneId.of("America/New_York"), rows.get(0).exchangeZone);
        assertEquals(185.64, rows.get(0).close, 1e-9);
        assertEquals(184.94, rows.get(0).adjClose, 1e-9);
        assertEquals(82_488_700L, rows.get(0).volume);
        assertTrue(Double.isNaN(rows.get(3).close));
        assertEquals(0L, rows.get(3).volume);
    }

    @Test
    void parsedRowsShouldNormalizeToExchangeDates() throws Exception {
        List<RawBar> rows = YahooChartClient.parseChart("AAPL", fixture("/yahoo/chart_aapl.json"));

        PriceSeries series = new BarNormalizer(ZoneId.of("America/New_York"))
                .normalize("AAPL", rows, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 9));

        assertEquals(4, series.size());
        assertEquals(LocalDate.of(2024, 1, 2), series.get(0).date);
        assertEquals(LocalDate.of(2024, 1, 8), series.get(3).date);
    }

    @Test
    void downloadHistoryShouldRequestHalfOpenRangeAtUtcMidnight() throws Exception {
        ScriptedHttp http = new ScriptedHttp();
        http.respond(200, fixture("/yahoo/chart_aapl.json"));
        RecordingChartClient client = client(http);

        List<RawBar> rows = client.downloadHistory("aapl", LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 9));

        assertEquals(5, rows.size());
        String url = http.urls.get(0);
        assertTrue(url.startsWith("https://chart.test/AAPL?"));
        assertTrue(url.contains("period1=1704153600"));
        assertTrue(url.contains("period2=1704758400"));
        assertTrue(url.contains("interval=1d"));
    }

    @Test
    void emptyRangeShouldNotCallProvider() throws Exception {
        ScriptedHttp http = new ScriptedHttp();
        RecordingChartClient client = client(http);

        assertTrue(client.downloadHistory("AAPL", LocalDate.of(2024, 1, 9), LocalDate.of(2024, 1, 9)).isEmpty());
        assertTrue(http.urls.isEmpty());
    }

    @Test
    void serverErrorsShouldBeRetriedWithLinearBackoff() throws Exception {
        ScriptedHttp http = new ScriptedHttp();
        http.respond(503, "unavailable");
        http.fail(new SocketTimeoutException("Read timed out"));
        http.respond(200, fixture("/yahoo/chart_aapl.json"));
        RecordingChartClient client = client(http);

        List<RawBar> rows = client.downloadHistory("AAPL", LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 9));

        assertEquals(5, rows.size());
        assertEquals(3, http.urls.size());
        assertEquals(List.of(700L, 1400L), client.sleeps);
    }

    @Test
    void exhaustedRetriesShouldRaiseRateLimitFailure() {
        ScriptedHttp http = new ScriptedHttp();
        http.respond(429, "");
        http.respond(429, "");
        http.respond(429, "");
        RecordingChartClient client = client(http);

        ProviderFetchException e = assertThrows(ProviderFetchException.class,
                () -> client.downloadHistory("AAPL", LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 9)));

        assertEquals("rate_limit", e.getCategory());
        assertTrue(e.isRetryable());
        assertEquals(3, http.urls.size());
        assertEquals(2, client.sleeps.size());
    }

    @Test
    void clientErrorShouldNotBeRetried() {
        ScriptedHttp http = new ScriptedHttp();
        http.respond(400, "bad request");
        RecordingChartClient client = client(http);

        ProviderFetchException e = assertThrows(ProviderFetchException.class,
                () -> client.downloadHistory("AAPL", LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 9)));

        assertFalse(e.isRetryable());
        assertEquals(1, http.urls.size());
        assertTrue(client.sleeps.isEmpty());
    }

    @Test
    void unknownSymbolShouldYieldNoRows() throws Exception {
        ScriptedHttp http = new ScriptedHttp();
        http.respond(404, "{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\"}}}");
        assertTrue(client(http).downloadHistory("NOPE", LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 9)).isEmpty());

        String errorBody = "{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\",\"description\":\"No data found\"}}}";
        assertTrue(YahooChartClient.parseChart("NOPE", errorBody).isEmpty());
    }

    @Test
    void malformedPayloadShouldRaiseNonRetryableFailure() {
        ProviderFetchException e = assertThrows(ProviderFetchException.class,
                () -> YahooChartClient.parseChart("AAPL", "<html>oops</html>"));

        assertEquals("payload", e.getCategory());
        assertFalse(e.isRetryable());
    }

    @Test
    void lastPriceShouldReadRegularMarketPriceAndSwallowFailures() throws Exception {
        ScriptedHttp http = new ScriptedHttp();
        http.respond(200, fixture("/yahoo/chart_aapl.json"));
        http.respond(500, "");
        http.respond(500, "");
        http.respond(500, "");
        RecordingChartClient client = client(http);

        OptionalDouble price = client.lastPrice("AAPL");
        OptionalDouble failed = client.lastPrice("AAPL");

        assertEquals(185.56, price.getAsDouble(), 1e-9);
        assertFalse(failed.isPresent());
    }

    @Test
    void classifyFailureMessageShouldRecognizeTimeouts() {
        assertEquals("timeout", YahooChartClient.classifyFailureMessage("Read timed out"));
        assertEquals("timeout", YahooChartClient.classifyFailureMessage("Connection reset by peer"));
        assertEquals("network", YahooChartClient.classifyFailureMessage("No route to host"));
        assertEquals("network", YahooChartClient.classifyFailureMessage(null));
    }

    static String fixture(String resource) throws IOException {
        try (InputStream in = YahooChartClientTest.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("missing fixture " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static RecordingChartClient client(HttpClientEx http) {
        Config config = Config.of(Path.of("."), Map.of(
                "provider.chart_url", "https://chart.test/%s",
                "provider.retry_count", "2",
                "provider.retry_sleep_ms", "700"
        ));
        return new RecordingChartClient(config, http);
    }

    private static final class RecordingChartClient extends YahooChartClient {
        final List<Long> sleeps = new ArrayList<>();

        RecordingChartClient(Config config, HttpClientEx http) {
            super(config, http);
        }

        @Override
        protected void sleep(long millis) {
            sleeps.add(millis);
        }
    }

    static final class ScriptedHttp extends HttpClientEx {
        final List<String> urls = new ArrayList<>();
        private final Deque<Object> script = new ArrayDeque<>();

        void respond(int status, String body) {
            script.add(new Response(status, body));
        }

        void fail(IOException e) {
            script.add(e);
        }

        @Override
        public Response get(String url, int timeoutSeconds) throws IOException {
            urls.add(url);
            Object next = script.poll();
            if (next == null) {
                throw new IOException("no scripted response for " + url);
            }
            if (next instanceof IOException) {
                throw (IOException) next;
            }
            return (Response) next;
        }
    }
}
