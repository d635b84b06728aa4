package com.mmbrief.sync;

/**
 * Where the series returned by a sync came from.
 */
public enum SyncSource {
    /** Store already held the latest trading day; no network call. */
    STORE_CURRENT("store_current"),
    /** Missing range fetched, persisted and re-read. */
    INCREMENTAL("incremental"),
    /** Provider failed; previously stored rows returned as-is. */
    STORE_STALE("store_stale"),
    /** No usable store; full window fetched and kept in memory. */
    MEMORY_ONLY("memory_only");

    private final String label;

    SyncSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
