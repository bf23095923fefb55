package com.pricetracker.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

/**
 * Real-time price notification published on the {@code price_update:<itemId>} channel
 * after a successful fetch.
 */
@Builder(toBuilder = true)
public record PriceUpdate(
        @JsonProperty("product_id") UUID productId,
        @JsonProperty("old_price") BigDecimal oldPrice,
        @JsonProperty("new_price") BigDecimal newPrice,
        String currency,
        @JsonProperty("in_stock") boolean inStock,
        @JsonProperty("change_percent") BigDecimal changePercent,
        Instant timestamp) {

    public static String channelFor(UUID itemId) {
        return "price_update:" + itemId;
    }
}
