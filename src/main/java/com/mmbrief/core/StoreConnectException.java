package com.mmbrief.core;

/**
 * The persistent store could not be opened or read.
 */
public class StoreConnectException extends MarketBriefException {

    public StoreConnectException(String message) {
        super(message);
    }

    public StoreConnectException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String defaultErrorCode() {
        return "ERR-STORE-001";
    }
}
