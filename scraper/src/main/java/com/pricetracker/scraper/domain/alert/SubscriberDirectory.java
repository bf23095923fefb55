package com.pricetracker.scraper.domain.alert;

import java.util.Optional;
import java.util.UUID;

public interface SubscriberDirectory {

    Optional<SubscriberSettings> find(UUID userId);
}
