package com.pricetracker.scraper.domain.alert;

import com.pricetracker.scraper.domain.tracking.TrackedItem;

/**
 * A persisted alert together with the item as it was before the observation that fired it.
 */
public record AlertNotification(AlertEvent event, TrackedItem item) {

    public AlertNotification withEvent(AlertEvent updated) {
        return new AlertNotification(updated, item);
    }
}
