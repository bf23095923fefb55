package com.pricetracker.scraper.domain.alert;

import com.pricetracker.common.event.AlertKind;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

/**
 * A fired alert. {@code id} is null until the event store has accepted it.
 * {@code percentChange} is expressed in percent, e.g. -15.0000 for a 15% drop.
 */
@Builder(toBuilder = true)
public record AlertEvent(
        UUID id,
        UUID itemId,
        UUID subscriberId,
        AlertKind kind,
        BigDecimal oldPrice,
        BigDecimal newPrice,
        BigDecimal percentChange,
        BigDecimal threshold,
        Instant triggeredAt,
        DeliveryStatus deliveryStatus,
        String deliveryMethod,
        String errorSummary) {

    public BigDecimal savings() {
        return oldPrice == null || newPrice == null ? BigDecimal.ZERO : oldPrice.subtract(newPrice);
    }
}
