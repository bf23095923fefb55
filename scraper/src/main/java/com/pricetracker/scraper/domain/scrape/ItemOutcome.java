package com.pricetracker.scraper.domain.scrape;

public enum ItemOutcome {
    SUCCEEDED,
    FAILED,
    SKIPPED_NO_PROXY,
    SKIPPED_IN_FLIGHT,
    /** Paused, errored or already refreshed between listing and the fetch. */
    SKIPPED_NOT_DUE,
    NOT_FOUND,
    /** Queued when the cycle aborted or the worker pool shut down. */
    ABANDONED;

    public boolean isSkip() {
        return this != SUCCEEDED && this != FAILED;
    }
}
