package com.pricetracker.scraper.application.job;

import com.pricetracker.scraper.domain.exceptions.StoreUnavailableException;
import com.pricetracker.scraper.domain.scrape.ScrapeOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic trigger for scrape cycles. Runs with a fixed delay, so the next cycle is scheduled
 * only after the previous one settled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeCycleJob {

    private final ScrapeOrchestrator orchestrator;

    @Scheduled(
            fixedDelayString = "${scraper.cycle.interval}",
            initialDelayString = "${scraper.cycle.initial-delay}")
    public void runScheduledCycle() {
        try {
            orchestrator.runCycle();
        } catch (StoreUnavailableException e) {
            log.error("Scheduled scrape cycle aborted, retrying at next interval: {}", e.getMessage());
        }
    }
}
