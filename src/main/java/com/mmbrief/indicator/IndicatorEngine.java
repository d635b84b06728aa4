package com.mmbrief.indicator;

import com.mmbrief.model.IndicatorRow;
import com.mmbrief.model.IndicatorSeries;
import com.mmbrief.model.PriceBar;
import com.mmbrief.model.PriceSeries;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 模块说明：IndicatorEngine（class）。
 * 主要职责：对整段日线逐行计算 SMA、RSI、MACD、布林带与 ATR，输出与输入逐行对齐的指标序列。
 * 使用建议：纯函数，不修改入参；窗口未满的字段为 NaN，调用方不得当作 0 处理。
 */
public final class IndicatorEngine {
    public static final int SMA_SHORT = 20;
    public static final int SMA_MID = 50;
    public static final int SMA_LONG = 200;
    public static final int RSI_PERIOD = 14;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int BOLLINGER_PERIOD = 20;
    public static final double BOLLINGER_K = 2.0;
    public static final int ATR_PERIOD = 14;

    public IndicatorSeries compute(PriceSeries series) {
        if (series == null || series.isEmpty()) {
            return new IndicatorSeries(series == null ? "" : series.ticker(), List.of());
        }
        int size = series.size();
        double[] closes = series.closes();
        double[] highs = series.highs();
        double[] lows = series.lows();

        double[] sma20 = sma(closes, SMA_SHORT);
        double[] sma50 = sma(closes, SMA_MID);
        double[] sma200 = sma(closes, SMA_LONG);
        double[] rsi14 = rsi(closes, RSI_PERIOD);

        double[] emaFast = ema(closes, MACD_FAST);
        double[] emaSlow = ema(closes, MACD_SLOW);
        double[] macd = new double[size];
        for (int i = 0; i < size; i++) {
            macd[i] = emaFast[i] - emaSlow[i];
        }
        double[] signal = ema(macd, MACD_SIGNAL);

        double[] std20 = sampleStd(closes, BOLLINGER_PERIOD);
        double[] atr14 = sma(trueRange(highs, lows, closes), ATR_PERIOD);

        List<IndicatorRow> rows = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            PriceBar bar = series.get(i);
            double mid = sma20[i];
            double upper = mid + BOLLINGER_K * std20[i];
            double lower = mid - BOLLINGER_K * std20[i];
            double bandwidth = Double.isNaN(mid) || mid == 0.0 ? Double.NaN : (upper - lower) / mid * 100.0;
            rows.add(new IndicatorRow(
                    bar,
                    sma20[i],
                    sma50[i],
                    sma200[i],
                    rsi14[i],
                    macd[i],
                    signal[i],
                    macd[i] - signal[i],
                    upper,
                    lower,
                    bandwidth,
                    atr14[i]
            ));
        }
        return new IndicatorSeries(series.ticker(), rows);
    }

    /**
     * Trailing mean over {@code window} rows; NaN until the window is full.
     */
    static double[] sma(double[] values, int window) {
        double[] out = nanArray(values.length);
        for (int i = window - 1; i < values.length; i++) {
            double sum = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                sum += values[j];
            }
            out[i] = sum / window;
        }
        return out;
    }

    static double[] sampleStd(double[] values, int window) {
        double[] out = nanArray(values.length);
        if (window < 2) {
            return out;
        }
        for (int i = window - 1; i < values.length; i++) {
            double sum = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                sum += values[j];
            }
            double mean = sum / window;
            double sq = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                double d = values[j] - mean;
                sq += d * d;
            }
            out[i] = Math.sqrt(sq / (window - 1));
        }
        return out;
    }

    /**
     * Simple-mean RSI. The first difference counts as zero gain and zero loss, so the
     * first defined value sits at index {@code period - 1}.
     */
    static double[] rsi(double[] closes, int period) {
        int n = closes.length;
        double[] gains = new double[n];
        double[] losses = new double[n];
        for (int i = 1; i < n; i++) {
            double diff = closes[i] - closes[i - 1];
            gains[i] = Math.max(diff, 0.0);
            losses[i] = Math.max(-diff, 0.0);
        }
        double[] avgGain = sma(gains, period);
        double[] avgLoss = sma(losses, period);
        double[] out = nanArray(n);
        for (int i = period - 1; i < n; i++) {
            if (avgLoss[i] == 0.0) {
                out[i] = 100.0;
            } else {
                double rs = avgGain[i] / avgLoss[i];
                out[i] = 100.0 - 100.0 / (1.0 + rs);
            }
        }
        return out;
    }

    /**
     * Recursive EMA, alpha = 2/(span+1), seeded with the first value. Defined from row 0.
     */
    static double[] ema(double[] values, int span) {
        double[] out = new double[values.length];
        if (values.length == 0) {
            return out;
        }
        double alpha = 2.0 / (span + 1.0);
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = alpha * values[i] + (1.0 - alpha) * out[i - 1];
        }
        return out;
    }

    static double[] trueRange(double[] highs, double[] lows, double[] closes) {
        int n = closes.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double range = highs[i] - lows[i];
            if (i == 0) {
                out[i] = range;
                continue;
            }
            double prevClose = closes[i - 1];
            out[i] = Math.max(range, Math.max(Math.abs(highs[i] - prevClose), Math.abs(lows[i] - prevClose)));
        }
        return out;
    }

    private static double[] nanArray(int n) {
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}
