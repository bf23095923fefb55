package com.pricetracker.scraper.domain.alert;

/**
 * Daily and per-user counters of delivered alerts. Best effort.
 */
public interface AlertCounter {

    void recordSent(AlertEvent event);
}
