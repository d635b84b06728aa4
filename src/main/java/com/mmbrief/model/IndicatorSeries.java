package com.mmbrief.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Indicator rows positionally aligned with the source series.
 */
public final class IndicatorSeries {
    private final String ticker;
    private final List<IndicatorRow> rows;

    public IndicatorSeries(String ticker, List<IndicatorRow> rows) {
        this.ticker = ticker == null ? "" : ticker;
        this.rows = Collections.unmodifiableList(rows == null ? List.of() : new ArrayList<>(rows));
    }

    public String ticker() {
        return ticker;
    }

    public List<IndicatorRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public IndicatorRow get(int index) {
        return rows.get(index);
    }

    public Optional<IndicatorRow> last() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(rows.size() - 1));
    }

    public double[] bandwidths() {
        double[] out = new double[rows.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = rows.get(i).bbBandwidth;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndicatorSeries)) {
            return false;
        }
        IndicatorSeries other = (IndicatorSeries) o;
        return ticker.equals(other.ticker) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * ticker.hashCode() + rows.hashCode();
    }
}
