package com.mmbrief.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable, date-ascending bars of a single ticker.
 */
public final class PriceSeries {
    private final String ticker;
    private final List<PriceBar> bars;

    public PriceSeries(String ticker, List<PriceBar> bars) {
        this.ticker = ticker == null ? "" : ticker;
        List<PriceBar> copy = bars == null ? List.of() : new ArrayList<>(bars);
        LocalDate previous = null;
        for (PriceBar bar : copy) {
            if (!bar.ticker.equals(this.ticker)) {
                throw new IllegalArgumentException("bar ticker=" + bar.ticker + " does not match series ticker=" + this.ticker);
            }
            if (previous != null && !bar.date.isAfter(previous)) {
                throw new IllegalArgumentException("dates must be strictly ascending: " + previous + " then " + bar.date);
            }
            previous = bar.date;
        }
        this.bars = Collections.unmodifiableList(copy);
    }

    public static PriceSeries empty(String ticker) {
        return new PriceSeries(ticker, List.of());
    }

    public String ticker() {
        return ticker;
    }

    public List<PriceBar> bars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public PriceBar get(int index) {
        return bars.get(index);
    }

    public Optional<PriceBar> last() {
        return bars.isEmpty() ? Optional.empty() : Optional.of(bars.get(bars.size() - 1));
    }

    public Optional<LocalDate> lastDate() {
        return last().map(bar -> bar.date);
    }

    /**
     * Percent change of the last close against the one before it; empty with fewer than
     * two bars.
     */
    public OptionalDouble changePct() {
        if (bars.size() < 2) {
            return OptionalDouble.empty();
        }
        double previous = bars.get(bars.size() - 2).close;
        double latest = bars.get(bars.size() - 1).close;
        if (previous == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((latest - previous) / previous * 100.0);
    }

    public double[] closes() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).close;
        }
        return out;
    }

    public double[] highs() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).high;
        }
        return out;
    }

    public double[] lows() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).low;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceSeries)) {
            return false;
        }
        PriceSeries other = (PriceSeries) o;
        return ticker.equals(other.ticker) && bars.equals(other.bars);
    }

    @Override
    public int hashCode() {
        return 31 * ticker.hashCode() + bars.hashCode();
    }

    @Override
    public String toString() {
        return "PriceSeries{" + ticker + " size=" + bars.size() + " last=" + lastDate().map(LocalDate::toString).orElse("-") + "}";
    }
}
