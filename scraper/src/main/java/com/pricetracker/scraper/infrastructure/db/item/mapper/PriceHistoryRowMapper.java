package com.pricetracker.scraper.infrastructure.db.item.mapper;

import com.pricetracker.scraper.domain.tracking.Snapshot;
import com.pricetracker.scraper.infrastructure.db.item.PriceHistoryRow;
import java.time.Duration;
import java.util.UUID;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface PriceHistoryRowMapper {

    @Mapping(target = "id", expression = "java(java.util.UUID.randomUUID())")
    @Mapping(target = "productId", source = "itemId")
    @Mapping(target = "scrapedAt", source = "snapshot.observedAt")
    @Mapping(target = "responseTimeMs", source = "snapshot.responseTime")
    PriceHistoryRow toRow(UUID itemId, Snapshot snapshot);

    default Integer toMillis(Duration duration) {
        return duration == null ? null : Math.toIntExact(duration.toMillis());
    }
}
