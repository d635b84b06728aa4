package com.mmbrief.sync;

import com.mmbrief.model.PriceBar;
import com.mmbrief.model.PriceSeries;
import com.mmbrief.model.RawBar;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns provider rows into a clean daily series: exchange-local dates, weekdays only,
 * one row per date (last wins), ascending, positive finite closes, clamped to
 * {@code [startInclusive, endExclusive)}.
 */
public final class BarNormalizer {
    private final ZoneId fallbackZone;

    public BarNormalizer(ZoneId fallbackZone) {
        this.fallbackZone = fallbackZone == null ? TradingCalendar.DEFAULT_ZONE : fallbackZone;
    }

    public PriceSeries normalize(String ticker, List<RawBar> rows, LocalDate startInclusive, LocalDate endExclusive) {
        if (rows == null || rows.isEmpty()) {
            return PriceSeries.empty(ticker);
        }
        Map<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (RawBar row : rows) {
            if (row == null || row.timestamp == null) {
                continue;
            }
            ZoneId zone = row.exchangeZone == null ? fallbackZone : row.exchangeZone;
            LocalDate date = row.timestamp.atZone(zone).toLocalDate();
            if (!TradingCalendar.isTradingDay(date)) {
                continue;
            }
            if (startInclusive != null && date.isBefore(startInclusive)) {
                continue;
            }
            if (endExclusive != null && !date.isBefore(endExclusive)) {
                continue;
            }
            if (!Double.isFinite(row.close) || row.close <= 0.0) {
                continue;
            }
            // later rows replace earlier ones for the same date
            byDate.put(date, new PriceBar(ticker, date, row.open, row.high, row.low, row.close, Math.max(0L, row.volume)));
        }
        return new PriceSeries(ticker, new ArrayList<>(byDate.values()));
    }
}
