package com.mmbrief.signal;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trend, momentum and volatility labels of the latest indicator row.
 */
public record SignalSet(
        TrendSignal trend,
        MomentumSignal momentum,
        VolatilitySignal volatility
) {
    public SignalSet {
        trend = trend == null ? TrendSignal.UNKNOWN : trend;
        momentum = momentum == null ? MomentumSignal.UNKNOWN : momentum;
        volatility = volatility == null ? VolatilitySignal.UNKNOWN : volatility;
    }

    public static SignalSet unknown() {
        return new SignalSet(TrendSignal.UNKNOWN, MomentumSignal.UNKNOWN, VolatilitySignal.UNKNOWN);
    }

    public Map<String, String> asLabels() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("Trend", trend.label());
        out.put("Momentum", momentum.label());
        out.put("Volatility", volatility.label());
        return out;
    }
}
