package com.mmbrief.runner;

import com.mmbrief.sync.SyncSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Ordered per-ticker outcomes of one run plus the analyses that succeeded.
 */
public final class RunSummary {
    private final List<Entry> entries = new ArrayList<>();
    private final List<TickerAnalysis> analyses = new ArrayList<>();

    public void succeeded(String ticker, SyncSource source, int bars) {
        entries.add(new Entry(ticker, true, source, bars, null, ""));
    }

    public void skipped(String ticker, SkipReason reason, String error) {
        entries.add(new Entry(ticker, false, null, 0, reason == null ? SkipReason.ERROR : reason, error));
    }

    public void addAnalysis(TickerAnalysis analysis) {
        analyses.add(analysis);
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<TickerAnalysis> analyses() {
        return Collections.unmodifiableList(analyses);
    }

    public int succeededCount() {
        int count = 0;
        for (Entry entry : entries) {
            if (entry.succeeded) {
                count++;
            }
        }
        return count;
    }

    public int skippedCount() {
        return entries.size() - succeededCount();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US, "tickers=%d succeeded=%d skipped=%d",
                entries.size(), succeededCount(), skippedCount()));
        for (Entry entry : entries) {
            sb.append('\n');
            if (entry.succeeded) {
                sb.append(String.format(Locale.US, "  OK   %-8s source=%s bars=%d",
                        entry.ticker, entry.source.label(), entry.bars));
            } else {
                sb.append(String.format(Locale.US, "  SKIP %-8s reason=%s", entry.ticker, entry.reason.label()));
                if (!entry.error.isEmpty()) {
                    sb.append(" error=").append(entry.error);
                }
            }
        }
        return sb.toString();
    }

    public static final class Entry {
        public final String ticker;
        public final boolean succeeded;
        public final SyncSource source;
        public final int bars;
        public final SkipReason reason;
        public final String error;

        private Entry(String ticker, boolean succeeded, SyncSource source, int bars, SkipReason reason, String error) {
            this.ticker = ticker;
            this.succeeded = succeeded;
            this.source = source;
            this.bars = bars;
            this.reason = reason;
            this.error = error == null ? "" : error.replaceAll("\\s+", " ").trim();
        }
    }
}
