package com.pricetracker.scraper.domain.proxy;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record ProxyPoolSettings(
        Duration coolDown,
        Duration sweepInterval,
        Duration probeTimeout,
        int probeConcurrency,
        List<URI> probeTargets,
        double failureRateThreshold,
        int minOutcomesForBlock,
        double latencyAlpha) {

    public static ProxyPoolSettingsBuilder defaults() {
        return ProxyPoolSettings.builder()
                .coolDown(Duration.ofMinutes(30))
                .sweepInterval(Duration.ofMinutes(5))
                .probeTimeout(Duration.ofSeconds(10))
                .probeConcurrency(16)
                .probeTargets(List.of(
                        URI.create("https://httpbin.org/ip"),
                        URI.create("https://checkip.amazonaws.com"),
                        URI.create("https://icanhazip.com")))
                .failureRateThreshold(0.5)
                .minOutcomesForBlock(10)
                .latencyAlpha(0.1);
    }
}
