package com.mmbrief.core;

public class NoDataException extends MarketBriefException {

    public NoDataException(String ticker) {
        super("no data for ticker=" + ticker);
    }

    @Override
    protected String defaultErrorCode() {
        return "ERR-DATA-001";
    }
}
