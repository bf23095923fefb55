package com.pricetracker.scraper.infrastructure.db.item;

import com.pricetracker.common.event.ItemStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface TrackedItemJpaRepository extends JpaRepository<TrackedItemRow, UUID> {

    @Query(value = "SELECT * FROM products "
            + "WHERE status = 'ACTIVE' "
            + "AND (last_checked IS NULL "
            + "OR last_checked <= CAST(:now AS timestamptz) - make_interval(hours => check_interval_hours)) "
            + "ORDER BY last_checked ASC NULLS FIRST "
            + "LIMIT :limit", nativeQuery = true)
    List<TrackedItemRow> findDue(Instant now, int limit);

    @Modifying
    @Query("UPDATE TrackedItemRow i SET i.errorCount = :errorCount, i.status = :status, i.lastError = :lastError, "
            + "i.lastChecked = :checkedAt, i.updatedAt = :checkedAt WHERE i.id = :itemId")
    int updateErrorState(UUID itemId, int errorCount, ItemStatus status, String lastError, Instant checkedAt);
}
