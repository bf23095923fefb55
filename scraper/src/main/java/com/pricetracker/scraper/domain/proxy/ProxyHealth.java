package com.pricetracker.scraper.domain.proxy;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable per-endpoint health record. Only touched while the owning pool holds its lock.
 */
final class ProxyHealth {

    private long selectionCount;
    private long successCount;
    private long failureCount;
    private Double averageLatencyMillis;
    private Instant blockedUntil;
    private boolean probeFailed;
    private Instant lastUsed;

    boolean isEligible(Instant now) {
        return !probeFailed && !isBlocked(now);
    }

    boolean isBlocked(Instant now) {
        return blockedUntil != null && blockedUntil.isAfter(now);
    }

    double successRate() {
        var reported = successCount + failureCount;
        return reported == 0 ? 0.5 : (double) successCount / reported;
    }

    double score() {
        return 0.7 * successRate() + 0.3 * (1.0 / (selectionCount + 1));
    }

    void markSelected(Instant now) {
        selectionCount++;
        lastUsed = now;
    }

    void recordSuccess(Duration latency, double latencyAlpha) {
        successCount++;
        blockedUntil = null;
        var sample = (double) latency.toMillis();
        averageLatencyMillis = averageLatencyMillis == null
                ? sample
                : (1 - latencyAlpha) * averageLatencyMillis + latencyAlpha * sample;
    }

    /**
     * @return true when this failure put the endpoint into cool-down
     */
    boolean recordFailure(Instant now, ProxyPoolSettings settings) {
        failureCount++;
        var reported = successCount + failureCount;
        var failureRate = (double) failureCount / reported;
        if (reported >= settings.minOutcomesForBlock()
                && failureRate > settings.failureRateThreshold()
                && !isBlocked(now)) {
            blockedUntil = now.plus(settings.coolDown());
            return true;
        }
        return false;
    }

    void probePassed() {
        if (blockedUntil != null) {
            selectionCount = 0;
            successCount = 0;
            failureCount = 0;
            averageLatencyMillis = null;
        }
        blockedUntil = null;
        probeFailed = false;
    }

    void probeFailed() {
        probeFailed = true;
    }

    long selectionCount() {
        return selectionCount;
    }

    long successCount() {
        return successCount;
    }

    long failureCount() {
        return failureCount;
    }

    Double averageLatencyMillis() {
        return averageLatencyMillis;
    }

    Instant blockedUntil() {
        return blockedUntil;
    }

    boolean hasFailedProbe() {
        return probeFailed;
    }

    Instant lastUsed() {
        return lastUsed;
    }
}
