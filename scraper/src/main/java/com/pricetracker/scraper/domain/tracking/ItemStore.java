package com.pricetracker.scraper.domain.tracking;

import com.pricetracker.common.event.ItemStatus;
import com.pricetracker.scraper.domain.exceptions.StoreUnavailableException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of tracked items. Every method throws {@link StoreUnavailableException} when the
 * backing store cannot be reached.
 */
public interface ItemStore {

    /**
     * ACTIVE items never checked or checked longer than their interval ago, oldest first.
     */
    List<TrackedItem> listDueItems(int limit, Instant now);

    Optional<TrackedItem> findById(UUID itemId);

    void updateSnapshot(UUID itemId, SnapshotUpdate update);

    void appendPriceHistory(UUID itemId, Snapshot snapshot);

    /**
     * Appends {@code snapshot} and applies {@code update} in one transaction.
     */
    void recordObservation(UUID itemId, Snapshot snapshot, SnapshotUpdate update);

    void setErrorState(UUID itemId, int errorCount, ItemStatus status, String lastError, Instant checkedAt);
}
