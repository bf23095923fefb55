package com.pricetracker.scraper.infrastructure.db.item;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface PriceHistoryJpaRepository extends JpaRepository<PriceHistoryRow, UUID> {
}
