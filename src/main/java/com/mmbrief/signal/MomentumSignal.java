package com.mmbrief.signal;

public enum MomentumSignal {
    UNKNOWN("Unknown"),
    OVERBOUGHT("Overbought"),
    OVERSOLD("Oversold"),
    STRONG("Strong"),
    WEAK("Weak"),
    NEUTRAL("Neutral");

    private final String label;

    MomentumSignal(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
