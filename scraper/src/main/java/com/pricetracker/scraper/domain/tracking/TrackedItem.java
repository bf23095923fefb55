package com.pricetracker.scraper.domain.tracking;

import com.pricetracker.common.event.ItemStatus;
import com.pricetracker.common.event.Marketplace;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

@Builder(toBuilder = true)
public record TrackedItem(
        UUID id,
        UUID ownerId,
        Marketplace marketplace,
        String marketplaceId,
        String url,
        String title,
        String currency,
        BigDecimal targetPrice,
        int checkIntervalHours,
        ItemStatus status,
        boolean inStock,
        Instant lastChecked,
        PriceStatistics statistics,
        int errorCount,
        String lastError) {

    public boolean isDue(Instant now) {
        return status == ItemStatus.ACTIVE
                && (lastChecked == null
                        || !lastChecked.plus(Duration.ofHours(checkIntervalHours)).isAfter(now));
    }

    public BigDecimal currentPrice() {
        return statistics == null ? null : statistics.currentPrice();
    }
}
