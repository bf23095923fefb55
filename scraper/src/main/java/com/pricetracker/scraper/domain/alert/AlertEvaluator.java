package com.pricetracker.scraper.domain.alert;

import com.pricetracker.common.event.AlertKind;
import com.pricetracker.scraper.domain.tracking.Snapshot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides which alerts a new observation fires. Stateless: the result depends only on the
 * arguments, which are never modified.
 *
 * <p>Price rules (drop, target, increase, new low) need a previous price and a changed price.
 * Back-in-stock only looks at availability.
 */
@Component
public class AlertEvaluator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public List<AlertEvent> evaluate(PriceSummary previous, Snapshot snapshot, AlertThresholds thresholds) {
        var events = new ArrayList<AlertEvent>();
        var oldPrice = previous.lastPrice();
        var newPrice = snapshot.price();
        var ratio = changeRatio(oldPrice, newPrice);
        var percentChange = ratio == null
                ? BigDecimal.ZERO.setScale(4)
                : ratio.multiply(HUNDRED).setScale(4, RoundingMode.HALF_UP);

        if (oldPrice != null && newPrice != null && oldPrice.compareTo(newPrice) != 0) {
            if (ratio != null && ratio.compareTo(thresholds.dropRatio().negate()) <= 0) {
                events.add(event(previous, snapshot, AlertKind.PRICE_DROP, percentChange, null));
            }
            if (thresholds.targetPrice() != null && newPrice.compareTo(thresholds.targetPrice()) <= 0) {
                events.add(event(previous, snapshot, AlertKind.PRICE_DROP, percentChange, thresholds.targetPrice()));
            }
            if (ratio != null
                    && thresholds.increaseRatio() != null
                    && ratio.compareTo(thresholds.increaseRatio()) >= 0) {
                events.add(event(previous, snapshot, AlertKind.PRICE_INCREASE, percentChange, null));
            }
            if (previous.historicalMin() != null && newPrice.compareTo(previous.historicalMin()) < 0) {
                events.add(event(previous, snapshot, AlertKind.NEW_LOW, percentChange, previous.historicalMin()));
            }
        }

        if (!previous.inStock() && snapshot.inStock()) {
            events.add(event(previous, snapshot, AlertKind.BACK_IN_STOCK, percentChange, null));
        }
        return List.copyOf(events);
    }

    private static BigDecimal changeRatio(BigDecimal oldPrice, BigDecimal newPrice) {
        if (oldPrice == null || newPrice == null || oldPrice.signum() == 0) {
            return null;
        }
        return newPrice.subtract(oldPrice).divide(oldPrice, MathContext.DECIMAL64);
    }

    private static AlertEvent event(
            PriceSummary previous, Snapshot snapshot, AlertKind kind, BigDecimal percentChange, BigDecimal threshold) {
        return AlertEvent.builder()
                .itemId(previous.itemId())
                .subscriberId(previous.subscriberId())
                .kind(kind)
                .oldPrice(previous.lastPrice() != null ? previous.lastPrice() : snapshot.price())
                .newPrice(snapshot.price())
                .percentChange(percentChange)
                .threshold(threshold)
                .triggeredAt(snapshot.observedAt())
                .deliveryStatus(DeliveryStatus.PENDING)
                .build();
    }
}
