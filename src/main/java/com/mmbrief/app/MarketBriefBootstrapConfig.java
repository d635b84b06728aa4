package com.mmbrief.app;

import com.mmbrief.app.properties.DbProperties;
import com.mmbrief.app.properties.SyncProperties;
import com.mmbrief.config.Config;
import com.mmbrief.core.StoreConnectException;
import com.mmbrief.data.MarketDataProvider;
import com.mmbrief.data.YahooChartClient;
import com.mmbrief.data.http.HttpClientEx;
import com.mmbrief.db.JdbcMarketStore;
import com.mmbrief.db.StoreFactory;
import com.mmbrief.indicator.IndicatorEngine;
import com.mmbrief.signal.SignalClassifier;
import com.mmbrief.sync.MarketDataSynchronizer;
import com.mmbrief.sync.TradingCalendar;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

/**
 * Wires the sync engine into a Spring application. Store beans are lazy so that an
 * embedding application that never syncs does not open a connection.
 */
@Configuration
@EnableConfigurationProperties({DbProperties.class, SyncProperties.class})
public class MarketBriefBootstrapConfig {
    @Bean
    public Config marketBriefConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    public TradingCalendar tradingCalendar(Config config) {
        return new TradingCalendar(ZoneId.of(config.getString("calendar.zone", TradingCalendar.DEFAULT_ZONE.getId())));
    }

    @Bean
    public MarketDataProvider marketDataProvider(Config config) {
        return new YahooChartClient(config, new HttpClientEx());
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public JdbcMarketStore marketHistoryStore(Config config, DbProperties dbProperties) {
        Config storeConfig = config.withOverrides(toConfigKeys(dbProperties));
        try {
            return new StoreFactory(storeConfig)
                    .open(dbProperties.isStrict())
                    .orElseThrow(() -> new IllegalStateException("no market history store available"));
        } catch (StoreConnectException e) {
            throw new IllegalStateException("Store initialization failed: " + e.getMessage(), e);
        }
    }

    @Bean
    @Lazy
    public MarketDataSynchronizer marketDataSynchronizer(
            JdbcMarketStore store,
            MarketDataProvider provider,
            TradingCalendar calendar,
            SyncProperties syncProperties
    ) {
        return new MarketDataSynchronizer(store, provider, calendar, Clock.systemUTC(), syncProperties.getHistoryYears());
    }

    @Bean
    public IndicatorEngine indicatorEngine() {
        return new IndicatorEngine();
    }

    @Bean
    public SignalClassifier signalClassifier() {
        return new SignalClassifier();
    }

    static Map<String, String> toConfigKeys(DbProperties dbProperties) {
        Map<String, String> out = new HashMap<>();
        if (dbProperties == null) {
            return out;
        }
        out.put("db.url", dbProperties.getUrl());
        out.put("db.user", dbProperties.getUser());
        out.put("db.pass", dbProperties.getPass());
        out.put("db.schema", dbProperties.getSchema());
        out.put("db.local_path", dbProperties.getLocalPath());
        out.put("db.strict", Boolean.toString(dbProperties.isStrict()));
        if (dbProperties.getSqlLog() != null) {
            out.put("db.sql_log.enabled", Boolean.toString(dbProperties.getSqlLog().isEnabled()));
        }
        return out;
    }
}
