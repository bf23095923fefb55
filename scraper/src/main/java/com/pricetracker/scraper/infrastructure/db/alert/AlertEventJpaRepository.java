package com.pricetracker.scraper.infrastructure.db.alert;

import com.pricetracker.scraper.domain.alert.DeliveryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.UUID;

public interface AlertEventJpaRepository extends JpaRepository<AlertEventRow, UUID> {

    @Modifying
    @Query("UPDATE AlertEventRow a SET a.deliveryStatus = :status, a.sent = true, a.sentAt = :sentAt, "
            + "a.notificationMethod = :method WHERE a.id = :alertId AND a.deliveryStatus = :expected")
    int markDelivered(UUID alertId, String method, Instant sentAt, DeliveryStatus status, DeliveryStatus expected);

    @Modifying
    @Query("UPDATE AlertEventRow a SET a.deliveryStatus = :status, a.errorMessage = :errorMessage "
            + "WHERE a.id = :alertId AND a.deliveryStatus = :expected")
    int markFailed(UUID alertId, String errorMessage, DeliveryStatus status, DeliveryStatus expected);
}
