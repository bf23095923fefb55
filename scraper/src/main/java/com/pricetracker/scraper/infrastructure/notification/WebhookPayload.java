package com.pricetracker.scraper.infrastructure.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricetracker.scraper.domain.alert.AlertNotification;
import java.math.BigDecimal;
import java.time.Instant;

record WebhookPayload(
        String event,
        @JsonProperty("alert_type") String alertType,
        Product product,
        @JsonProperty("price_change") PriceChange priceChange,
        Instant timestamp) {

    static final String EVENT = "price_alert";

    record Product(
            String id,
            String title,
            String url,
            String marketplace,
            @JsonProperty("current_price") BigDecimal currentPrice,
            String currency) {}

    record PriceChange(
            @JsonProperty("old_price") BigDecimal oldPrice,
            @JsonProperty("new_price") BigDecimal newPrice,
            @JsonProperty("change_percent") BigDecimal changePercent,
            BigDecimal savings) {}

    static WebhookPayload of(AlertNotification notification) {
        var event = notification.event();
        var item = notification.item();
        return new WebhookPayload(
                EVENT,
                event.kind().name(),
                new Product(
                        item.id().toString(),
                        item.title(),
                        item.url(),
                        item.marketplace().name(),
                        event.newPrice(),
                        item.currency()),
                new PriceChange(event.oldPrice(), event.newPrice(), event.percentChange(), event.savings()),
                event.triggeredAt());
    }
}
