package com.mmbrief.signal;

import com.mmbrief.model.IndicatorRow;
import com.mmbrief.model.IndicatorSeries;

/**
 * Labels the latest indicator row. Volatility also looks at the trailing
 * {@value #BANDWIDTH_WINDOW}-row mean of Bollinger bandwidth.
 */
public final class SignalClassifier {
    public static final int BANDWIDTH_WINDOW = 20;

    static final double OVERBOUGHT = 70.0;
    static final double OVERSOLD = 30.0;
    static final double STRONG = 60.0;
    static final double WEAK = 40.0;
    static final double ELEVATED_RATIO = 1.5;
    static final double COMPRESSED_RATIO = 0.7;

    public SignalSet classify(IndicatorSeries series) {
        if (series == null || series.isEmpty()) {
            return SignalSet.unknown();
        }
        IndicatorRow last = series.get(series.size() - 1);
        return new SignalSet(
                trend(last),
                momentum(last.rsi14),
                volatility(last.bbBandwidth, trailingBandwidthMean(series.bandwidths()))
        );
    }

    static TrendSignal trend(IndicatorRow row) {
        double close = row.close();
        double sma50 = row.sma50;
        double sma200 = row.sma200;
        if (!IndicatorRow.isDefined(sma50) || !IndicatorRow.isDefined(sma200)) {
            return TrendSignal.UNKNOWN;
        }
        if (close > sma50 && sma50 > sma200) {
            return TrendSignal.BULLISH;
        }
        if (close < sma50 && sma50 < sma200) {
            return TrendSignal.BEARISH;
        }
        if (close > sma200) {
            return TrendSignal.LEANING_BULLISH;
        }
        if (close < sma200) {
            return TrendSignal.LEANING_BEARISH;
        }
        return TrendSignal.NEUTRAL;
    }

    static MomentumSignal momentum(double rsi) {
        if (!IndicatorRow.isDefined(rsi)) {
            return MomentumSignal.NEUTRAL;
        }
        if (rsi > OVERBOUGHT) {
            return MomentumSignal.OVERBOUGHT;
        }
        if (rsi < OVERSOLD) {
            return MomentumSignal.OVERSOLD;
        }
        if (rsi > STRONG) {
            return MomentumSignal.STRONG;
        }
        if (rsi < WEAK) {
            return MomentumSignal.WEAK;
        }
        return MomentumSignal.NEUTRAL;
    }

    static VolatilitySignal volatility(double bandwidth, double average) {
        if (!IndicatorRow.isDefined(bandwidth) || !IndicatorRow.isDefined(average)) {
            return VolatilitySignal.NORMAL;
        }
        if (bandwidth > ELEVATED_RATIO * average) {
            return VolatilitySignal.ELEVATED;
        }
        if (bandwidth < COMPRESSED_RATIO * average) {
            return VolatilitySignal.COMPRESSED;
        }
        return VolatilitySignal.NORMAL;
    }

    /**
     * Mean of the last 20 bandwidths; NaN when fewer than 20 rows exist or any of them
     * is undefined.
     */
    static double trailingBandwidthMean(double[] bandwidths) {
        if (bandwidths.length < BANDWIDTH_WINDOW) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = bandwidths.length - BANDWIDTH_WINDOW; i < bandwidths.length; i++) {
            if (!IndicatorRow.isDefined(bandwidths[i])) {
                return Double.NaN;
            }
            sum += bandwidths[i];
        }
        return sum / BANDWIDTH_WINDOW;
    }
}
