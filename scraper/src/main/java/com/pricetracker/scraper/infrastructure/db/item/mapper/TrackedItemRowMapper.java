package com.pricetracker.scraper.infrastructure.db.item.mapper;

import com.pricetracker.scraper.domain.tracking.PriceStatistics;
import com.pricetracker.scraper.domain.tracking.TrackedItem;
import com.pricetracker.scraper.infrastructure.db.item.TrackedItemRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface TrackedItemRowMapper {

    @Mapping(target = "ownerId", source = "userId")
    @Mapping(target = "statistics", source = "row")
    TrackedItem toDomain(TrackedItemRow row);

    default PriceStatistics toStatistics(TrackedItemRow row) {
        return new PriceStatistics(
                row.getCurrentPrice(), row.getMinPrice(), row.getMaxPrice(), row.getAvgPrice(), row.getPriceChecksCount());
    }
}
