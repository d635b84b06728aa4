package com.mmbrief.signal;

public enum VolatilitySignal {
    UNKNOWN("Unknown"),
    ELEVATED("Elevated"),
    COMPRESSED("Compressed"),
    NORMAL("Normal");

    private final String label;

    VolatilitySignal(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
