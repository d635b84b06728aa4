package com.mmbrief.data;

import com.mmbrief.core.ProviderFetchException;

import java.util.Map;

public interface FundamentalsProvider {

    /**
     * Raw field values keyed by field name. Missing fields are simply absent.
     */
    Map<String, Object> fetch(String ticker) throws ProviderFetchException;
}
