package com.pricetracker.scraper.infrastructure.db.item;

import com.pricetracker.common.event.ItemStatus;
import com.pricetracker.scraper.domain.exceptions.StoreUnavailableException;
import com.pricetracker.scraper.domain.tracking.ItemStore;
import com.pricetracker.scraper.domain.tracking.Snapshot;
import com.pricetracker.scraper.domain.tracking.SnapshotUpdate;
import com.pricetracker.scraper.domain.tracking.TrackedItem;
import com.pricetracker.scraper.infrastructure.db.item.mapper.PriceHistoryRowMapper;
import com.pricetracker.scraper.infrastructure.db.item.mapper.TrackedItemRowMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Connectivity failures surface as {@link StoreUnavailableException}; data errors such as
 * constraint violations stay per-item failures.
 *
 * <p>Transactions are opened here through {@link TransactionTemplate} rather than
 * {@code @Transactional} so that failures at transaction start are translated too.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ItemStoreAdapter implements ItemStore {

    private final TrackedItemJpaRepository itemRepository;
    private final PriceHistoryJpaRepository historyRepository;
    private final TrackedItemRowMapper itemMapper;
    private final PriceHistoryRowMapper historyMapper;
    private final TransactionTemplate transactionTemplate;

    @Override
    public List<TrackedItem> listDueItems(int limit, Instant now) {
        return translate("listDueItems", () -> itemRepository.findDue(now, limit).stream()
                .map(itemMapper::toDomain)
                .toList());
    }

    @Override
    public Optional<TrackedItem> findById(UUID itemId) {
        return translate("findById", () -> itemRepository.findById(itemId).map(itemMapper::toDomain));
    }

    @Override
    public void updateSnapshot(UUID itemId, SnapshotUpdate update) {
        inTransaction("updateSnapshot", () -> applyUpdate(itemId, update));
    }

    @Override
    public void appendPriceHistory(UUID itemId, Snapshot snapshot) {
        inTransaction("appendPriceHistory", () -> historyRepository.save(historyMapper.toRow(itemId, snapshot)));
    }

    @Override
    public void recordObservation(UUID itemId, Snapshot snapshot, SnapshotUpdate update) {
        inTransaction("recordObservation", () -> {
            historyRepository.save(historyMapper.toRow(itemId, snapshot));
            applyUpdate(itemId, update);
        });
    }

    @Override
    public void setErrorState(UUID itemId, int errorCount, ItemStatus status, String lastError, Instant checkedAt) {
        inTransaction("setErrorState", () -> {
            var updated = itemRepository.updateErrorState(itemId, errorCount, status, lastError, checkedAt);
            if (updated == 0) {
                log.debug("Item {} disappeared before its error state was recorded", itemId);
            }
        });
    }

    private void applyUpdate(UUID itemId, SnapshotUpdate update) {
        var row = itemRepository.findById(itemId).orElse(null);
        if (row == null) {
            log.debug("Item {} disappeared before its snapshot was recorded", itemId);
            return;
        }
        var statistics = update.statistics();
        if (update.marketplaceId() != null) {
            row.setMarketplaceId(update.marketplaceId());
        }
        if (update.title() != null) {
            row.setTitle(update.title());
        }
        if (update.imageUrl() != null) {
            row.setImageUrl(update.imageUrl());
        }
        if (update.brand() != null) {
            row.setBrand(update.brand());
        }
        if (update.category() != null) {
            row.setCategory(update.category());
        }
        row.setInStock(update.inStock());
        row.setCurrentPrice(statistics.currentPrice());
        row.setMinPrice(statistics.minPrice());
        row.setMaxPrice(statistics.maxPrice());
        row.setAvgPrice(statistics.avgPrice());
        row.setPriceChecksCount(statistics.checkCount());
        row.setErrorCount(0);
        row.setLastError(null);
        row.setLastChecked(update.checkedAt());
        row.setUpdatedAt(update.checkedAt());
        itemRepository.save(row);
    }

    private void inTransaction(String operation, Runnable work) {
        translate(operation, () -> {
            transactionTemplate.executeWithoutResult(status -> work.run());
            return null;
        });
    }

    private <T> T translate(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessResourceFailureException
                | TransientDataAccessException
                | RecoverableDataAccessException
                | CannotCreateTransactionException e) {
            throw StoreUnavailableException.of(operation, e);
        }
    }
}
