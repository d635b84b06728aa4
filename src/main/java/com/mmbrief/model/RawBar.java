package com.mmbrief.model;

import java.time.Instant;
import java.time.ZoneId;

/**
 * One provider row before normalization. Carries the adjusted close and the exchange
 * time zone exactly as the chart payload reports them.
 */
public final class RawBar {
    public final Instant timestamp;
    public final ZoneId exchangeZone;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double adjClose;
    public final long volume;

    public RawBar(
            Instant timestamp,
            ZoneId exchangeZone,
            double open,
            double high,
            double low,
            double close,
            double adjClose,
            long volume
    ) {
        this.timestamp = timestamp;
        this.exchangeZone = exchangeZone;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.adjClose = adjClose;
        this.volume = volume;
    }
}
