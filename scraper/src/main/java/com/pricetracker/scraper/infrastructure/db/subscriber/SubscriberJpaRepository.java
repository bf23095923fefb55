package com.pricetracker.scraper.infrastructure.db.subscriber;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface SubscriberJpaRepository extends JpaRepository<SubscriberRow, UUID> {
}
