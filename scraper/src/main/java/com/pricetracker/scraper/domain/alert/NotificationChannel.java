package com.pricetracker.scraper.domain.alert;

import com.pricetracker.scraper.domain.exceptions.ChannelDeliveryException;

/**
 * One way of reaching a subscriber. The dispatcher enforces the per-channel timeout, so
 * implementations may block.
 */
public interface NotificationChannel {

    String type();

    boolean isEnabledFor(SubscriberSettings subscriber);

    /**
     * @throws ChannelDeliveryException when the transport rejects or fails the delivery
     */
    void send(AlertNotification notification, SubscriberSettings subscriber);
}
