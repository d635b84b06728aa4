package com.mmbrief.sync;

import com.mmbrief.model.PriceSeries;

import java.util.Objects;

public final class SyncResult {
    public final PriceSeries series;
    public final SyncSource source;
    public final int fetchedRows;
    public final int insertedRows;

    public SyncResult(PriceSeries series, SyncSource source, int fetchedRows, int insertedRows) {
        this.series = Objects.requireNonNull(series, "series");
        this.source = Objects.requireNonNull(source, "source");
        this.fetchedRows = Math.max(0, fetchedRows);
        this.insertedRows = Math.max(0, insertedRows);
    }

    @Override
    public String toString() {
        return "SyncResult{" + series.ticker()
                + " source=" + source.label()
                + " bars=" + series.size()
                + " fetched=" + fetchedRows
                + " inserted=" + insertedRows + "}";
    }
}
