package com.pricetracker.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

/**
 * Asks the scraper to fetch one tracked item outside the scheduled cycle.
 * Published when an item is created or a user requests a refresh.
 */
@Builder(toBuilder = true)
public record ScrapeRequest(
        @JsonProperty("item_id") UUID itemId,
        @JsonProperty("requested_by") UUID requestedBy,
        @JsonProperty("requested_at") Instant requestedAt) {}
