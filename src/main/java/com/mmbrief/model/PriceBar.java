package com.mmbrief.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 模块说明：PriceBar（class）。
 * 主要职责：一只股票一个交易日的 OHLCV 数据，入库后不可变。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class PriceBar {
    public final String ticker;
    public final LocalDate date;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final long volume;

    public PriceBar(String ticker, LocalDate date, double open, double high, double low, double close, long volume) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.date = Objects.requireNonNull(date, "date");
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceBar)) {
            return false;
        }
        PriceBar other = (PriceBar) o;
        return ticker.equals(other.ticker)
                && date.equals(other.date)
                && Double.compare(open, other.open) == 0
                && Double.compare(high, other.high) == 0
                && Double.compare(low, other.low) == 0
                && Double.compare(close, other.close) == 0
                && volume == other.volume;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ticker, date, open, high, low, close, volume);
    }

    @Override
    public String toString() {
        return "PriceBar{" + ticker + " " + date + " o=" + open + " h=" + high + " l=" + low
                + " c=" + close + " v=" + volume + "}";
    }
}
