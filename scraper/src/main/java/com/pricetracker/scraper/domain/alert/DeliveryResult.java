package com.pricetracker.scraper.domain.alert;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * @param deliveredVia channel types that accepted the alert
 * @param failures     reason per channel type that failed
 */
public record DeliveryResult(UUID alertId, DeliveryStatus status, List<String> deliveredVia, Map<String, String> failures) {

    public boolean delivered() {
        return status == DeliveryStatus.SENT;
    }
}
