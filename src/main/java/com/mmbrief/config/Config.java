package com.mmbrief.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：合并 classpath 配置、工作目录覆盖文件与代码默认值，提供类型化读取。
 * 使用建议：新增配置项时同步补充 buildDefaults，避免调用方各自写默认值。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    /**
     * Defaults only, plus explicit overrides. Used by tests and embedding code.
     */
    public static Config of(Path workingDir, Map<String, String> overrides) {
        Config config = new Config(workingDir);
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                putBoundValue(config, entry.getKey(), entry.getValue());
            }
        }
        return config;
    }

    /**
     * Copy of this config with {@code overrides} layered on top. Blank override values are ignored.
     */
    public Config withOverrides(Map<String, String> overrides) {
        Config copy = new Config(workingDir);
        copy.resourceProps.putAll(resourceProps);
        copy.overrideProps.putAll(overrideProps);
        copy.props.putAll(props);
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                if (entry.getValue() != null && !entry.getValue().trim().isEmpty()) {
                    putBoundValue(copy, entry.getKey(), entry.getValue());
                }
            }
        }
        return copy;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * Application home. Relative state paths resolve against it, never against the
     * process working directory.
     */
    public Path homeDir() {
        String value = getString("app.home");
        if (value.isEmpty()) {
            return Paths.get(System.getProperty("user.home"), ".mmbrief").toAbsolutePath().normalize();
        }
        Path raw = Paths.get(value);
        if (raw.isAbsolute()) {
            return raw.normalize();
        }
        return workingDir.resolve(raw).toAbsolutePath().normalize();
    }

    public Path getHomePath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return homeDir();
        }
        Path raw = Paths.get(value);
        if (raw.isAbsolute()) {
            return raw.normalize();
        }
        return homeDir().resolve(raw).normalize();
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (RuntimeException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("app.home", "");
        defaults.put("outputs.dir", "outputs");
        defaults.put("app.log_routing", "true");

        defaults.put("db.url", "");
        defaults.put("db.user", "mmbrief");
        defaults.put("db.pass", "");
        defaults.put("db.schema", "mmbrief");
        defaults.put("db.local_path", "market_history.db");
        defaults.put("db.strict", "false");
        defaults.put("db.connect_timeout_sec", "10");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("calendar.zone", "America/New_York");
        defaults.put("snapshot.enabled", "true");
        defaults.put("snapshot.tickers", "SPY,QQQ,^VIX,^IXIC");

        defaults.put("sync.history_years", "5");

        defaults.put("watchlist.path", "watchlist.txt");
        defaults.put("watchlist.tickers", "");

        defaults.put("provider.chart_url", "https://query1.finance.yahoo.com/v8/finance/chart/%s");
        defaults.put("provider.quote_summary_url",
                "https://query2.finance.yahoo.com/v10/finance/quoteSummary/%s"
                        + "?modules=price,summaryDetail,defaultKeyStatistics,financialData,assetProfile");
        defaults.put("provider.request_timeout_sec", "20");
        defaults.put("provider.retry_count", "2");
        defaults.put("provider.retry_sleep_ms", "700");
        defaults.put("provider.request_pause_ms", "0");

        defaults.put("fundamentals.cache_path", "fundamentals_cache.json");
        defaults.put("fundamentals.ttl_days", "7");
        defaults.put("fundamentals.request_pause_ms", "1000");

        return Collections.unmodifiableMap(defaults);
    }
}
