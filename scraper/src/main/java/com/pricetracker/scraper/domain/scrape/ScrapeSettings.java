package com.pricetracker.scraper.domain.scrape;

import java.time.Duration;
import lombok.Builder;

@Builder(toBuilder = true)
public record ScrapeSettings(int batchSize, int concurrency, int errorCeiling, Duration shutdownGrace) {

    public static ScrapeSettingsBuilder defaults() {
        return ScrapeSettings.builder()
                .batchSize(5000)
                .concurrency(50)
                .errorCeiling(10)
                .shutdownGrace(Duration.ofSeconds(30));
    }
}
