package com.mmbrief.db;

public enum StoreDialect {
    POSTGRES("postgres"),
    SQLITE("sqlite");

    private final String label;

    StoreDialect(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
