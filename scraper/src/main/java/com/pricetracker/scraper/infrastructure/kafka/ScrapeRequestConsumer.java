package com.pricetracker.scraper.infrastructure.kafka;

import com.pricetracker.common.event.ScrapeRequest;
import com.pricetracker.common.kafka.KafkaTopics;
import com.pricetracker.scraper.domain.scrape.ScrapeOrchestrator;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * On-demand scrapes requested by the API. The record is acknowledged once the item is queued,
 * not when the fetch completes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeRequestConsumer {

    private final ScrapeOrchestrator orchestrator;
    private final Counter scrapeRequestsCounter;

    @KafkaListener(
            topics = KafkaTopics.SCRAPE_REQUESTS,
            groupId = "scraper-requests",
            containerFactory = "scrapeRequestListenerContainerFactory")
    public void onScrapeRequest(ScrapeRequest request) {
        if (request.itemId() == null) {
            log.warn("Ignoring scrape request without item id (requested by {})", request.requestedBy());
            return;
        }
        log.debug("Received scrape request: item_id={}, requested_by={}", request.itemId(), request.requestedBy());
        scrapeRequestsCounter.increment();
        orchestrator.enqueue(request.itemId());
    }
}
