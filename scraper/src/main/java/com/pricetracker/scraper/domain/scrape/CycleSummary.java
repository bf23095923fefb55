package com.pricetracker.scraper.domain.scrape;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one scrape cycle. For a cycle that ran, {@code succeeded + failed + skipped == due}.
 *
 * @param overlapped true when the trigger was ignored because another cycle was running
 */
public record CycleSummary(
        int due, int succeeded, int failed, int skipped, Instant startedAt, Duration elapsed, boolean overlapped) {

    static CycleSummary overlapping(Instant now) {
        return new CycleSummary(0, 0, 0, 0, now, Duration.ZERO, true);
    }
}
