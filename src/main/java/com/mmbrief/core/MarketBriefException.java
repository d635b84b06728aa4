package com.mmbrief.core;

/**
 * Base of all checked failures raised by the sync engine. Each subclass supplies a
 * stable error code that ends up in logs and the run summary.
 */
public abstract class MarketBriefException extends Exception {
    private final String errorCode;

    protected MarketBriefException(String message) {
        super(message);
        this.errorCode = defaultErrorCode();
    }

    protected MarketBriefException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = defaultErrorCode();
    }

    public String getErrorCode() {
        return errorCode;
    }

    protected abstract String defaultErrorCode();
}
