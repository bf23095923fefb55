package com.pricetracker.scraper.infrastructure.db.alert;

import com.pricetracker.common.event.AlertKind;
import com.pricetracker.scraper.domain.alert.DeliveryStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "alerts")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertEventRow {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 20)
    private AlertKind alertType;

    @Column(name = "threshold_value", precision = 12, scale = 2)
    private BigDecimal thresholdValue;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Column(name = "old_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal oldPrice;

    @Column(name = "new_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal newPrice;

    @Column(name = "price_change_percent", nullable = false, precision = 10, scale = 4)
    private BigDecimal priceChangePercent;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_status", nullable = false, length = 10)
    private DeliveryStatus deliveryStatus;

    @Column(name = "is_sent", nullable = false)
    private boolean sent;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "notification_method", length = 50)
    private String notificationMethod;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;
}
