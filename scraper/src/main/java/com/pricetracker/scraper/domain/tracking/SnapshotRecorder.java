package com.pricetracker.scraper.domain.tracking;

import com.pricetracker.common.event.ItemStatus;
import com.pricetracker.scraper.domain.extraction.ExtractedListing;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the outcome of one fetch attempt. A successful observation appends the snapshot,
 * folds it into the statistics and clears the error state through one atomic store call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotRecorder {

    private final ItemStore itemStore;

    public Snapshot recordSuccess(TrackedItem item, ExtractedListing listing, Duration responseTime, Instant now) {
        var snapshot = Snapshot.builder()
                .price(listing.price())
                .currency(listing.currency() != null ? listing.currency() : item.currency())
                .inStock(listing.inStock())
                .sellerName(listing.sellerName())
                .sellerRating(listing.sellerRating())
                .reviewsCount(listing.reviewsCount())
                .shippingCost(listing.shippingCost())
                .responseTime(responseTime)
                .observedAt(now)
                .build();

        var statistics = (item.statistics() != null ? item.statistics() : PriceStatistics.empty())
                .accept(listing.price());

        itemStore.recordObservation(item.id(), snapshot, SnapshotUpdate.builder()
                .marketplaceId(listing.marketplaceId())
                .title(listing.title())
                .imageUrl(listing.imageUrl())
                .brand(listing.brand())
                .category(listing.category())
                .inStock(listing.inStock())
                .statistics(statistics)
                .checkedAt(now)
                .build());

        log.debug("Recorded price {} for item {} (check #{})", listing.price(), item.id(), statistics.checkCount());
        return snapshot;
    }

    /**
     * @return the status the item ends up in
     */
    public ItemStatus recordFailure(TrackedItem item, String error, Instant now, int errorCeiling) {
        var errorCount = item.errorCount() + 1;
        var status = errorCount >= errorCeiling ? ItemStatus.ERROR : item.status();
        itemStore.setErrorState(item.id(), errorCount, status, error, now);
        if (status == ItemStatus.ERROR && item.status() != ItemStatus.ERROR) {
            log.warn("Item {} moved to ERROR after {} consecutive failures: {}", item.id(), errorCount, error);
        }
        return status;
    }
}
