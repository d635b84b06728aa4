package com.mmbrief.fundamentals;

import com.mmbrief.config.Config;
import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.data.FundamentalsProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-ticker fundamentals cache with a fixed time-to-live, persisted as one JSON file.
 * Lifecycle: {@link #open()} at run start, {@link #get(String)} per ticker, {@link #flush()}
 * at run end.
 */
public class FundamentalsCache {
    private static final Logger log = LogManager.getLogger(FundamentalsCache.class);

    private final Path file;
    private final FundamentalsProvider provider;
    private final Clock clock;
    private final Duration ttl;
    private final long requestPauseMs;
    private final Map<String, FundamentalsSnapshot> entries = new TreeMap<>();
    private boolean providerCalled;
    private boolean dirty;

    public FundamentalsCache(Config config, FundamentalsProvider provider) {
        this(
                config.getHomePath("fundamentals.cache_path"),
                provider,
                Clock.systemUTC(),
                Duration.ofDays(Math.max(0, config.getInt("fundamentals.ttl_days", 7))),
                Math.max(0L, config.getLong("fundamentals.request_pause_ms", 1000L))
        );
    }

    public FundamentalsCache(Path file, FundamentalsProvider provider, Clock clock, Duration ttl, long requestPauseMs) {
        this.file = file;
        this.provider = provider;
        this.clock = clock;
        this.ttl = ttl;
        this.requestPauseMs = requestPauseMs;
    }

    /**
     * Loads the cache file. A missing file starts empty; an unreadable one is logged and
     * replaced on the next flush.
     */
    public void open() throws IOException {
        entries.clear();
        providerCalled = false;
        dirty = false;
        if (!Files.exists(file)) {
            return;
        }
        String text = Files.readString(file, StandardCharsets.UTF_8);
        if (text.trim().isEmpty()) {
            return;
        }
        try {
            JSONObject root = new JSONObject(text);
            for (String ticker : root.keySet()) {
                JSONObject entry = root.optJSONObject(ticker);
                if (entry != null) {
                    entries.put(ticker, FundamentalsSnapshot.fromJson(ticker, entry));
                }
            }
            log.info("fundamentals cache loaded path={} entries={}", file, entries.size());
        } catch (JSONException e) {
            log.warn("fundamentals cache unreadable, starting empty path={} err={}", file, e.getMessage());
        }
    }

    public FundamentalsSnapshot get(String ticker) {
        String key = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        if (key.isEmpty()) {
            return FundamentalsSnapshot.empty("");
        }
        long now = clock.instant().getEpochSecond();
        FundamentalsSnapshot cached = entries.get(key);
        if (cached != null && isFresh(cached, now)) {
            return cached;
        }

        if (providerCalled) {
            try {
                pause(requestPauseMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("fundamentals pause interrupted ticker={}", key);
                return FundamentalsSnapshot.empty(key);
            }
        }
        providerCalled = true;
        try {
            Map<String, Object> raw = provider.fetch(key);
            FundamentalsSnapshot fresh = new FundamentalsSnapshot(key, raw, clock.instant().getEpochSecond());
            entries.put(key, fresh);
            dirty = true;
            return fresh;
        } catch (ProviderFetchException e) {
            log.warn("fundamentals fetch failed ticker={} category={} err={}", key, e.getCategory(), e.getMessage());
            return FundamentalsSnapshot.empty(key);
        } catch (RuntimeException e) {
            log.warn("fundamentals fetch failed ticker={} err={}", key, e.toString(), e);
            return FundamentalsSnapshot.empty(key);
        }
    }

    /**
     * Writes the cache when it changed: temp file in the same directory, then an atomic move.
     */
    public void flush() throws IOException {
        if (!dirty) {
            return;
        }
        JSONObject root = new JSONObject();
        for (Map.Entry<String, FundamentalsSnapshot> entry : entries.entrySet()) {
            root.put(entry.getKey(), entry.getValue().toJson());
        }
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, "fundamentals", ".tmp");
        try {
            Files.writeString(tmp, root.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        dirty = false;
        log.info("fundamentals cache written path={} entries={}", file, entries.size());
    }

    public int size() {
        return entries.size();
    }

    public Path file() {
        return file;
    }

    private boolean isFresh(FundamentalsSnapshot snapshot, long nowEpochSec) {
        return nowEpochSec - snapshot.lastFetched() < ttl.getSeconds();
    }

    protected void pause(long millis) throws InterruptedException {
        if (millis > 0L) {
            TimeUnit.MILLISECONDS.sleep(millis);
        }
    }
}
