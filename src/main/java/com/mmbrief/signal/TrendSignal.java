package com.mmbrief.signal;

public enum TrendSignal {
    UNKNOWN("Unknown"),
    BULLISH("Bullish"),
    BEARISH("Bearish"),
    LEANING_BULLISH("Leaning Bullish"),
    LEANING_BEARISH("Leaning Bearish"),
    NEUTRAL("Neutral");

    private final String label;

    TrendSignal(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
