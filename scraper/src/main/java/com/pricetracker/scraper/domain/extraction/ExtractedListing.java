package com.pricetracker.scraper.domain.extraction;

import java.math.BigDecimal;
import lombok.Builder;

/**
 * Normalized marketplace listing. Only {@code price} is guaranteed; every other field may be
 * null when the page does not expose it.
 */
@Builder(toBuilder = true)
public record ExtractedListing(
        String marketplaceId,
        String title,
        BigDecimal price,
        String currency,
        boolean inStock,
        String brand,
        String imageUrl,
        String category,
        String sellerName,
        BigDecimal sellerRating,
        Integer reviewsCount,
        BigDecimal shippingCost) {}
