package com.mmbrief.data;

import com.mmbrief.config.Config;
import com.mmbrief.core.ProviderFetchException;
import com.mmbrief.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * quoteSummary client. One request per call; pacing is the cache's job.
 */
public class YahooFundamentalsClient implements FundamentalsProvider {
    private final HttpClientEx http;
    private final String quoteSummaryUrl;
    private final int timeoutSec;

    public YahooFundamentalsClient(Config config, HttpClientEx http) {
        this.http = http;
        this.quoteSummaryUrl = config.getString("provider.quote_summary_url");
        this.timeoutSec = Math.max(3, config.getInt("provider.request_timeout_sec", 20));
    }

    @Override
    public Map<String, Object> fetch(String ticker) throws ProviderFetchException {
        String symbol = URLEncoder.encode(ticker.trim().toUpperCase(Locale.ROOT), StandardCharsets.UTF_8);
        String url = String.format(quoteSummaryUrl, symbol);
        HttpClientEx.Response resp;
        try {
            resp = http.get(url, timeoutSec);
        } catch (IOException e) {
            throw new ProviderFetchException("quoteSummary request failed ticker=" + ticker, "network", true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFetchException("quoteSummary interrupted ticker=" + ticker, "interrupted", false, e);
        }
        if (!resp.isSuccess()) {
            throw new ProviderFetchException(
                    "quoteSummary http status=" + resp.status + " ticker=" + ticker,
                    resp.status == 429 ? "rate_limit" : "http_status",
                    resp.status == 429 || resp.status >= 500
            );
        }
        return parse(ticker, resp.body);
    }

    public static Map<String, Object> parse(String ticker, String body) throws ProviderFetchException {
        Map<String, Object> out = new LinkedHashMap<>();
        JSONObject r0;
        try {
            JSONObject summary = new JSONObject(body).optJSONObject("quoteSummary");
            JSONArray result = summary == null ? null : summary.optJSONArray("result");
            r0 = (result == null || result.length() == 0) ? null : result.optJSONObject(0);
        } catch (JSONException e) {
            throw new ProviderFetchException("quoteSummary payload unparseable ticker=" + ticker, "payload", false, e);
        }
        if (r0 == null) {
            return out;
        }
        JSONObject price = r0.optJSONObject("price");
        JSONObject detail = r0.optJSONObject("summaryDetail");
        JSONObject stats = r0.optJSONObject("defaultKeyStatistics");
        JSONObject financial = r0.optJSONObject("financialData");
        JSONObject profile = r0.optJSONObject("assetProfile");

        putNumber(out, "marketCap", price, detail);
        putNumber(out, "trailingPE", detail);
        putNumber(out, "forwardPE", detail, stats);
        putNumber(out, "dividendYield", detail);
        putNumber(out, "profitMargins", financial, stats);
        putNumber(out, "revenueGrowth", financial);
        putText(out, "shortName", price);
        putText(out, "sector", profile);
        putText(out, "industry", profile);
        return out;
    }

    // Yahoo wraps numbers as {"raw": 1.0, "fmt": "1.00"}; first module carrying the field wins.
    private static void putNumber(Map<String, Object> out, String field, JSONObject... modules) {
        for (JSONObject module : modules) {
            if (module == null || !module.has(field) || module.isNull(field)) {
                continue;
            }
            Object raw = module.get(field);
            double value = Double.NaN;
            if (raw instanceof JSONObject) {
                value = ((JSONObject) raw).optDouble("raw", Double.NaN);
            } else if (raw instanceof Number) {
                value = ((Number) raw).doubleValue();
            }
            if (Double.isFinite(value)) {
                out.put(field, value);
                return;
            }
        }
    }

    private static void putText(Map<String, Object> out, String field, JSONObject module) {
        if (module == null) {
            return;
        }
        String value = module.optString(field, "").trim();
        if (!value.isEmpty()) {
            out.put(field, value);
        }
    }
}
