package com.pricetracker.scraper.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scraper")
public record ScraperProperties(
        @NotNull @Valid Cycle cycle,
        @NotNull @Valid Proxy proxy,
        @NotNull @Valid Fetch fetch,
        @NotNull @Valid Alerts alerts,
        @NotNull @Valid Redis redis) {

    public record Cycle(
            @NotNull Duration interval,
            @NotNull Duration initialDelay,
            @Min(1) int batchSize,
            @Min(1) int concurrency,
            @Min(1) int errorCeiling,
            @NotNull Duration shutdownGrace) {}

    public record Proxy(
            @NotNull List<String> endpoints,
            @NotNull Duration coolDown,
            @NotNull Duration sweepInterval,
            @NotNull Duration probeTimeout,
            @Min(1) int probeConcurrency,
            @NotEmpty List<URI> probeTargets) {}

    public record Fetch(
            @NotNull Duration requestTimeout,
            @NotNull Duration connectTimeout,
            @NotEmpty List<String> userAgents) {}

    /**
     * Thresholds are ratios: 0.10 means a 10% move.
     */
    public record Alerts(
            @NotNull @DecimalMin("0.0") BigDecimal dropThreshold,
            @DecimalMin("0.0") BigDecimal increaseThreshold,
            @NotNull Duration channelTimeout,
            @NotBlank String mailFrom,
            @NotBlank String frontendUrl) {}

    public record Redis(boolean enabled) {}
}
