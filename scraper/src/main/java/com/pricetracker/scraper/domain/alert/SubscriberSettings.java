package com.pricetracker.scraper.domain.alert;

import java.util.UUID;
import lombok.Builder;

@Builder(toBuilder = true)
public record SubscriberSettings(
        UUID userId,
        String email,
        boolean emailEnabled,
        boolean webhookEnabled,
        String webhookUrl) {}
