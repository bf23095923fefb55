package com.pricetracker.scraper.domain.proxy;

import lombok.Builder;

@Builder
public record ProxyPoolStats(
        int endpoints,
        int eligible,
        int blocked,
        long selections,
        long successes,
        long failures,
        double successRate,
        double averageLatencyMillis) {}
