package com.pricetracker.scraper.domain.tracking;

import com.pricetracker.common.event.PriceUpdate;

/**
 * Best-effort fan-out of committed price observations to other processes.
 */
public interface PriceUpdatePublisher {

    void publish(PriceUpdate update);
}
