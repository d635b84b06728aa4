package com.mmbrief.core;

/**
 * Upstream market-data call failed after retries.
 */
public class ProviderFetchException extends MarketBriefException {
    private final String category;
    private final boolean retryable;

    public ProviderFetchException(String message, String category, boolean retryable) {
        super(message);
        this.category = category == null ? "other" : category;
        this.retryable = retryable;
    }

    public ProviderFetchException(String message, String category, boolean retryable, Throwable cause) {
        super(message, cause);
        this.category = category == null ? "other" : category;
        this.retryable = retryable;
    }

    public String getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    protected String defaultErrorCode() {
        return "ERR-PROVIDER-001";
    }
}
