package com.pricetracker.scraper.domain.scrape;

import io.micrometer.core.instrument.Counter;

public record ScrapeCounters(
        Counter succeeded,
        Counter failed,
        Counter skipped,
        Counter parseErrors,
        Counter cyclesCompleted,
        Counter cyclesAborted) {}
