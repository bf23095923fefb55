package com.pricetracker.scraper.infrastructure.db.alert;

import com.pricetracker.scraper.domain.alert.AlertEvent;
import com.pricetracker.scraper.domain.alert.AlertEventStore;
import com.pricetracker.scraper.domain.alert.DeliveryStatus;
import com.pricetracker.scraper.infrastructure.db.alert.mapper.AlertEventRowMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Alert rows start PENDING and move to SENT or FAILED exactly once; the conditional updates
 * ignore a second transition.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class AlertEventStoreAdapter implements AlertEventStore {

    private final AlertEventJpaRepository jpaRepository;
    private final AlertEventRowMapper mapper;

    @Override
    @Transactional
    public UUID createAlert(AlertEvent event) {
        var row = mapper.toRow(event.toBuilder()
                .id(UUID.randomUUID())
                .deliveryStatus(DeliveryStatus.PENDING)
                .build());
        return jpaRepository.save(row).getId();
    }

    @Override
    @Transactional
    public void markDelivered(UUID alertId, String deliveryMethod, Instant deliveredAt) {
        var updated = jpaRepository.markDelivered(
                alertId, deliveryMethod, deliveredAt, DeliveryStatus.SENT, DeliveryStatus.PENDING);
        if (updated == 0) {
            log.debug("Skipped delivery update for alert {} (not PENDING)", alertId);
        }
    }

    @Override
    @Transactional
    public void markFailed(UUID alertId, String errorSummary) {
        var updated = jpaRepository.markFailed(alertId, errorSummary, DeliveryStatus.FAILED, DeliveryStatus.PENDING);
        if (updated == 0) {
            log.debug("Skipped failure update for alert {} (not PENDING)", alertId);
        }
    }
}
