package com.mmbrief.model;

import java.util.Objects;

/**
 * 模块说明：IndicatorRow（class）。
 * 主要职责：一根 K 线及其派生指标；窗口未满的字段为 NaN。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class IndicatorRow {
    public final PriceBar bar;
    public final double sma20;
    public final double sma50;
    public final double sma200;
    public final double rsi14;
    public final double macd;
    public final double macdSignal;
    public final double macdHist;
    public final double bbUpper;
    public final double bbLower;
    public final double bbBandwidth;
    public final double atr14;

    public IndicatorRow(
            PriceBar bar,
            double sma20,
            double sma50,
            double sma200,
            double rsi14,
            double macd,
            double macdSignal,
            double macdHist,
            double bbUpper,
            double bbLower,
            double bbBandwidth,
            double atr14
    ) {
        this.bar = Objects.requireNonNull(bar, "bar");
        this.sma20 = sma20;
        this.sma50 = sma50;
        this.sma200 = sma200;
        this.rsi14 = rsi14;
        this.macd = macd;
        this.macdSignal = macdSignal;
        this.macdHist = macdHist;
        this.bbUpper = bbUpper;
        this.bbLower = bbLower;
        this.bbBandwidth = bbBandwidth;
        this.atr14 = atr14;
    }

    public double close() {
        return bar.close;
    }

    public static boolean isDefined(double value) {
        return !Double.isNaN(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndicatorRow)) {
            return false;
        }
        IndicatorRow other = (IndicatorRow) o;
        return bar.equals(other.bar)
                && Double.compare(sma20, other.sma20) == 0
                && Double.compare(sma50, other.sma50) == 0
                && Double.compare(sma200, other.sma200) == 0
                && Double.compare(rsi14, other.rsi14) == 0
                && Double.compare(macd, other.macd) == 0
                && Double.compare(macdSignal, other.macdSignal) == 0
                && Double.compare(macdHist, other.macdHist) == 0
                && Double.compare(bbUpper, other.bbUpper) == 0
                && Double.compare(bbLower, other.bbLower) == 0
                && Double.compare(bbBandwidth, other.bbBandwidth) == 0
                && Double.compare(atr14, other.atr14) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bar, sma20, sma50, sma200, rsi14, macd, macdSignal, macdHist,
                bbUpper, bbLower, bbBandwidth, atr14);
    }
}
