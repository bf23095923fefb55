package com.pricetracker.scraper.domain.alert;

import com.pricetracker.scraper.domain.tracking.TrackedItem;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * What the evaluator knows about an item before the new observation: the last committed price,
 * the historical minimum and the last stock state.
 */
public record PriceSummary(UUID itemId, UUID subscriberId, BigDecimal lastPrice, BigDecimal historicalMin, boolean inStock) {

    public static PriceSummary of(TrackedItem item) {
        var statistics = item.statistics();
        return new PriceSummary(
                item.id(),
                item.ownerId(),
                statistics == null ? null : statistics.currentPrice(),
                statistics == null ? null : statistics.minPrice(),
                item.inStock());
    }
}
