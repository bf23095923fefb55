package com.pricetracker.scraper.application.config;

import com.pricetracker.scraper.domain.alert.AlertSettings;
import com.pricetracker.scraper.domain.proxy.ProxyEndpoint;
import com.pricetracker.scraper.domain.proxy.ProxyPool;
import com.pricetracker.scraper.domain.proxy.ProxyPoolSettings;
import com.pricetracker.scraper.domain.proxy.ProxyProbe;
import com.pricetracker.scraper.domain.proxy.ProxyStatusPublisher;
import com.pricetracker.scraper.domain.scrape.ScrapeSettings;
import java.time.Clock;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(ScraperProperties.class)
public class ScraperConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScrapeSettings scrapeSettings(ScraperProperties properties) {
        var cycle = properties.cycle();
        return ScrapeSettings.builder()
                .batchSize(cycle.batchSize())
                .concurrency(cycle.concurrency())
                .errorCeiling(cycle.errorCeiling())
                .shutdownGrace(cycle.shutdownGrace())
                .build();
    }

    @Bean
    public AlertSettings alertSettings(ScraperProperties properties) {
        var alerts = properties.alerts();
        return AlertSettings.builder()
                .dropRatio(alerts.dropThreshold())
                .increaseRatio(alerts.increaseThreshold())
                .channelTimeout(alerts.channelTimeout())
                .build();
    }

    @Bean
    public ProxyPoolSettings proxyPoolSettings(ScraperProperties properties) {
        var proxy = properties.proxy();
        return ProxyPoolSettings.defaults()
                .coolDown(proxy.coolDown())
                .sweepInterval(proxy.sweepInterval())
                .probeTimeout(proxy.probeTimeout())
                .probeConcurrency(proxy.probeConcurrency())
                .probeTargets(proxy.probeTargets())
                .build();
    }

    @Bean
    public ProxyPool proxyPool(
            ProxyProbe proxyProbe,
            ProxyStatusPublisher proxyStatusPublisher,
            ProxyPoolSettings proxyPoolSettings,
            ScraperProperties properties,
            Clock clock) {
        var pool = new ProxyPool(proxyProbe, proxyStatusPublisher, proxyPoolSettings, clock, new Random());
        for (var raw : properties.proxy().endpoints()) {
            var endpoint = ProxyEndpoint.parse(raw);
            if (endpoint.scheme().startsWith("socks")) {
                log.warn("Skipping proxy {}: only HTTP(S) proxies are supported", endpoint);
                continue;
            }
            pool.add(endpoint);
        }
        if (pool.size() == 0) {
            log.warn("No proxies configured; every scrape will be skipped until endpoints are added");
        }
        return pool;
    }
}
