package com.pricetracker.scraper.infrastructure.db.item;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
@Table(name = "price_history")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PriceHistoryRow {

    @Id
    private UUID id;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "in_stock", nullable = false)
    private boolean inStock;

    @Column(name = "shipping_cost", precision = 12, scale = 2)
    private BigDecimal shippingCost;

    @Column(name = "seller_name")
    private String sellerName;

    @Column(name = "seller_rating", precision = 4, scale = 2)
    private BigDecimal sellerRating;

    @Column(name = "reviews_count")
    private Integer reviewsCount;

    @Column(name = "scraped_at", nullable = false)
    private Instant scrapedAt;

    @Column(name = "response_time_ms")
    private Integer responseTimeMs;
}
