package com.mmbrief.core;

/**
 * A write batch was rejected and rolled back; none of its rows are stored.
 */
public class StoreWriteException extends MarketBriefException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String defaultErrorCode() {
        return "ERR-STORE-002";
    }
}
