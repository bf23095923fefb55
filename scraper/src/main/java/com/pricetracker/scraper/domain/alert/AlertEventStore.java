package com.pricetracker.scraper.domain.alert;

import java.time.Instant;
import java.util.UUID;

public interface AlertEventStore {

    UUID createAlert(AlertEvent event);

    void markDelivered(UUID alertId, String deliveryMethod, Instant deliveredAt);

    void markFailed(UUID alertId, String errorSummary);
}
