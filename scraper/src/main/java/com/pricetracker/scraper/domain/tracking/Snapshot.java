package com.pricetracker.scraper.domain.tracking;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;

/**
 * One observation of an item, appended to its price history and never changed.
 */
@Builder
public record Snapshot(
        BigDecimal price,
        String currency,
        boolean inStock,
        String sellerName,
        BigDecimal sellerRating,
        Integer reviewsCount,
        BigDecimal shippingCost,
        Duration responseTime,
        Instant observedAt) {}
