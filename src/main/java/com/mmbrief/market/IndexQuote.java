package com.mmbrief.market;

import java.util.Locale;
import java.util.Objects;

/**
 * One line of the market snapshot. Unavailable quotes carry price and change 0 and a
 * label of {@code N/A} (no bars) or {@code Error} (fetch failed).
 */
public final class IndexQuote {
    public static final String LABEL_NO_DATA = "N/A";
    public static final String LABEL_ERROR = "Error";

    public final String symbol;
    public final String name;
    public final double price;
    public final double previousClose;
    public final double changePct;
    public final String label;
    public final boolean available;

    private IndexQuote(
            String symbol,
            String name,
            double price,
            double previousClose,
            double changePct,
            String label,
            boolean available
    ) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.name = name == null || name.isBlank() ? symbol : name;
        this.price = price;
        this.previousClose = previousClose;
        this.changePct = changePct;
        this.label = label;
        this.available = available;
    }

    public static IndexQuote of(String symbol, String name, double price, double previousClose, boolean showLevel) {
        double changePct = previousClose == 0.0 ? 0.0 : (price - previousClose) / previousClose * 100.0;
        String change = String.format(Locale.ROOT, "%+.1f%%", changePct);
        String label = showLevel ? String.format(Locale.ROOT, "%.2f (%s)", price, change) : change;
        return new IndexQuote(symbol, name, price, previousClose, changePct, label, true);
    }

    public static IndexQuote unavailable(String symbol, String name, String label) {
        return new IndexQuote(symbol, name, 0.0, 0.0, 0.0, label, false);
    }

    @Override
    public String toString() {
        return name + " [" + symbol + "] " + label;
    }
}
