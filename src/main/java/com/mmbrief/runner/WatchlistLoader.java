package com.mmbrief.runner;

import com.mmbrief.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Resolves the tickers of a run: command-line tickers, then {@code watchlist.tickers},
 * then the {@code watchlist.path} file (one ticker per line, {@code #} starts a comment).
 */
public final class WatchlistLoader {
    private static final Logger log = LogManager.getLogger(WatchlistLoader.class);

    private final Config config;

    public WatchlistLoader(Config config) {
        this.config = config;
    }

    public List<String> load(List<String> cliTickers) throws IOException {
        if (cliTickers != null && !cliTickers.isEmpty()) {
            return normalize(cliTickers);
        }
        List<String> configured = config.getList("watchlist.tickers");
        if (!configured.isEmpty()) {
            return normalize(configured);
        }
        Path file = config.getHomePath("watchlist.path");
        if (!Files.exists(file)) {
            log.warn("watchlist file not found path={}", file);
            return List.of();
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<String> out = normalize(lines);
        log.info("watchlist loaded path={} tickers={}", file, out.size());
        return out;
    }

    public static List<String> normalize(List<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        for (String line : raw) {
            if (line == null) {
                continue;
            }
            String text = line;
            int hash = text.indexOf('#');
            if (hash >= 0) {
                text = text.substring(0, hash);
            }
            for (String token : text.split("[,;\\s]+")) {
                String ticker = token.trim().toUpperCase(Locale.ROOT);
                if (!ticker.isEmpty()) {
                    out.add(ticker);
                }
            }
        }
        return new ArrayList<>(out);
    }
}
