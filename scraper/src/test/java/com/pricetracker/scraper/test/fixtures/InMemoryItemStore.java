package com.pricetracker.scraper.test.fixtures;

import com.pricetracker.common.event.ItemStatus;
import com.pricetracker.scraper.domain.exceptions.StoreUnavailableException;
import com.pricetracker.scraper.domain.tracking.ItemStore;
import com.pricetracker.scraper.domain.tracking.Snapshot;
import com.pricetracker.scraper.domain.tracking.SnapshotUpdate;
import com.pricetracker.scraper.domain.tracking.TrackedItem;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thread-safe item store that can be told to become unreachable.
 */
public class InMemoryItemStore implements ItemStore {

    private final Map<UUID, TrackedItem> items = new ConcurrentHashMap<>();
    private final Map<UUID, List<Snapshot>> history = new ConcurrentHashMap<>();
    private final Set<UUID> unreachableOnWrite = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean unreachable = new AtomicBoolean();
    private final CountDownLatch listed = new CountDownLatch(1);

    public void save(TrackedItem item) {
        items.put(item.id(), item);
    }

    public TrackedItem get(UUID itemId) {
        return items.get(itemId);
    }

    public List<Snapshot> history(UUID itemId) {
        return history.getOrDefault(itemId, List.of());
    }

    /**
     * Waits until due items have been listed at least once.
     */
    public boolean awaitListing(Duration timeout) throws InterruptedException {
        return listed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void goOffline() {
        unreachable.set(true);
    }

    public void failWritesFor(UUID itemId) {
        unreachableOnWrite.add(itemId);
    }

    @Override
    public List<TrackedItem> listDueItems(int limit, Instant now) {
        checkReachable("listDueItems");
        var due = items.values().stream()
                .filter(item -> item.isDue(now))
                .sorted(Comparator.comparing(TrackedItem::lastChecked, Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(limit)
                .toList();
        listed.countDown();
        return due;
    }

    @Override
    public Optional<TrackedItem> findById(UUID itemId) {
        checkReachable("findById");
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public void updateSnapshot(UUID itemId, SnapshotUpdate update) {
        checkWritable("updateSnapshot", itemId);
        items.computeIfPresent(itemId, (id, item) -> item.toBuilder()
                .title(update.title() != null ? update.title() : item.title())
                .marketplaceId(update.marketplaceId() != null ? update.marketplaceId() : item.marketplaceId())
                .inStock(update.inStock())
                .statistics(update.statistics())
                .lastChecked(update.checkedAt())
                .errorCount(0)
                .lastError(null)
                .build());
    }

    @Override
    public void appendPriceHistory(UUID itemId, Snapshot snapshot) {
        checkWritable("appendPriceHistory", itemId);
        history.computeIfAbsent(itemId, id -> new CopyOnWriteArrayList<>()).add(snapshot);
    }

    @Override
    public void recordObservation(UUID itemId, Snapshot snapshot, SnapshotUpdate update) {
        checkWritable("recordObservation", itemId);
        appendPriceHistory(itemId, snapshot);
        updateSnapshot(itemId, update);
    }

    @Override
    public void setErrorState(UUID itemId, int errorCount, ItemStatus status, String lastError, Instant checkedAt) {
        checkWritable("setErrorState", itemId);
        items.computeIfPresent(itemId, (id, item) -> item.toBuilder()
                .errorCount(errorCount)
                .status(status)
                .lastError(lastError)
                .lastChecked(checkedAt)
                .build());
    }

    public List<TrackedItem> all() {
        return new ArrayList<>(items.values());
    }

    private void checkReachable(String operation) {
        if (unreachable.get()) {
            throw StoreUnavailableException.of(operation, new IllegalStateException("connection refused"));
        }
    }

    private void checkWritable(String operation, UUID itemId) {
        checkReachable(operation);
        if (unreachableOnWrite.contains(itemId)) {
            throw StoreUnavailableException.of(operation, new IllegalStateException("connection reset"));
        }
    }
}
