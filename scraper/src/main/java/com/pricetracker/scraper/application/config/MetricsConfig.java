package com.pricetracker.scraper.application.config;

import com.pricetracker.scraper.domain.proxy.ProxyPool;
import com.pricetracker.scraper.domain.scrape.ScrapeCounters;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public ScrapeCounters scrapeCounters(MeterRegistry registry) {
        return new ScrapeCounters(
                counter(registry, "scraper.items.succeeded", "Items fetched and recorded"),
                counter(registry, "scraper.items.failed", "Item fetches that failed"),
                counter(registry, "scraper.items.skipped", "Items skipped (no proxy, in flight, unknown)"),
                counter(registry, "scraper.items.parse-errors", "Pages whose shape did not match the extractor"),
                counter(registry, "scraper.cycles.completed", "Scrape cycles that settled normally"),
                counter(registry, "scraper.cycles.aborted", "Scrape cycles aborted by an item store failure"));
    }

    @Bean
    public Counter alertsDeliveredCounter(MeterRegistry registry) {
        return counter(registry, "alerts.delivered", "Alerts accepted by at least one channel");
    }

    @Bean
    public Counter alertsFailedCounter(MeterRegistry registry) {
        return counter(registry, "alerts.failed", "Alerts no channel accepted");
    }

    @Bean
    public Counter scrapeRequestsCounter(MeterRegistry registry) {
        return counter(registry, "scraper.requests.received", "On-demand scrape requests consumed from Kafka");
    }

    @Bean
    public Gauge proxyEndpointsGauge(MeterRegistry registry, ProxyPool proxyPool) {
        return Gauge.builder("scraper.proxy.endpoints", proxyPool::size)
                .description("Known proxy endpoints")
                .register(registry);
    }

    @Bean
    public Gauge proxyEligibleGauge(MeterRegistry registry, ProxyPool proxyPool) {
        return Gauge.builder("scraper.proxy.eligible", proxyPool::eligibleCount)
                .description("Proxy endpoints currently eligible for selection")
                .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name)
                .description(description)
                .register(registry);
    }
}
