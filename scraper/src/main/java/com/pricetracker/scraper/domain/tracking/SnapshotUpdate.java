package com.pricetracker.scraper.domain.tracking;

import java.time.Instant;
import lombok.Builder;

/**
 * Item fields rewritten after a successful fetch. Null metadata fields keep the stored value.
 */
@Builder
public record SnapshotUpdate(
        String marketplaceId,
        String title,
        String imageUrl,
        String brand,
        String category,
        boolean inStock,
        PriceStatistics statistics,
        Instant checkedAt) {}
