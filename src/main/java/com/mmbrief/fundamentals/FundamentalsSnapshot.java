package com.mmbrief.fundamentals;

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 模块说明：FundamentalsSnapshot（class）。
 * 主要职责：单只股票的基本面字段快照，附带最后拉取时间（epoch 秒）。
 * 使用建议：字段集合固定为 FIELDS，未知字段在构造时丢弃；lastFetched 为 0 表示空快照。
 */
public final class FundamentalsSnapshot {
    public static final String LAST_FETCHED = "last_fetched";
    public static final List<String> FIELDS = List.of(
            "marketCap", "trailingPE", "forwardPE", "dividendYield", "profitMargins",
            "revenueGrowth", "shortName", "sector", "industry"
    );

    private final String ticker;
    private final Map<String, Object> values;
    private final long lastFetched;

    public FundamentalsSnapshot(String ticker, Map<String, ?> raw, long lastFetched) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        Map<String, Object> ordered = new LinkedHashMap<>();
        if (raw != null) {
            for (String field : FIELDS) {
                Object value = raw.get(field);
                if (value != null && value != JSONObject.NULL) {
                    ordered.put(field, value);
                }
            }
        }
        this.values = Collections.unmodifiableMap(ordered);
        this.lastFetched = Math.max(0L, lastFetched);
    }

    public static FundamentalsSnapshot empty(String ticker) {
        return new FundamentalsSnapshot(ticker, Map.of(), 0L);
    }

    public String ticker() {
        return ticker;
    }

    public Map<String, Object> values() {
        return values;
    }

    public long lastFetched() {
        return lastFetched;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            out.put(entry.getKey(), entry.getValue());
        }
        out.put(LAST_FETCHED, lastFetched);
        return out;
    }

    public static FundamentalsSnapshot fromJson(String ticker, JSONObject json) {
        if (json == null) {
            return empty(ticker);
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        for (String field : FIELDS) {
            if (json.has(field) && !json.isNull(field)) {
                raw.put(field, json.get(field));
            }
        }
        return new FundamentalsSnapshot(ticker, raw, json.optLong(LAST_FETCHED, 0L));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FundamentalsSnapshot)) {
            return false;
        }
        FundamentalsSnapshot other = (FundamentalsSnapshot) o;
        return lastFetched == other.lastFetched && ticker.equals(other.ticker) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ticker, values, lastFetched);
    }

    @Override
    public String toString() {
        return "FundamentalsSnapshot{" + ticker + " fields=" + values.keySet() + " last_fetched=" + lastFetched + "}";
    }
}
