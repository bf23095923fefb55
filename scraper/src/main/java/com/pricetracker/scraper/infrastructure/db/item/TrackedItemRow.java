package com.pricetracker.scraper.infrastructure.db.item;

import com.pricetracker.common.event.ItemStatus;
import com.pricetracker.common.event.Marketplace;
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

/**
 * JPA entity for the products table. Rows are created by the surrounding application; the
 * scraper only rewrites snapshot, statistics and error columns.
 */
@Entity
@Table(name = "products")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackedItemRow {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Marketplace marketplace;

    @Column(name = "marketplace_id", nullable = false)
    private String marketplaceId;

    @Column(nullable = false, columnDefinition = "text")
    private String url;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(name = "image_url", columnDefinition = "text")
    private String imageUrl;

    private String brand;

    private String category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ItemStatus status;

    @Column(name = "target_price", precision = 12, scale = 2)
    private BigDecimal targetPrice;

    @Column(name = "check_interval_hours", nullable = false)
    private int checkIntervalHours;

    @Column(name = "current_price", precision = 12, scale = 2)
    private BigDecimal currentPrice;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "in_stock", nullable = false)
    private boolean inStock;

    @Column(name = "last_checked")
    private Instant lastChecked;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "error_count", nullable = false)
    private int errorCount;

    @Column(name = "min_price", precision = 12, scale = 2)
    private BigDecimal minPrice;

    @Column(name = "max_price", precision = 12, scale = 2)
    private BigDecimal maxPrice;

    @Column(name = "avg_price", precision = 16, scale = 6)
    private BigDecimal avgPrice;

    @Column(name = "price_checks_count", nullable = false)
    private int priceChecksCount;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
