package com.pricetracker.scraper.infrastructure.db.alert.mapper;

import com.pricetracker.scraper.domain.alert.AlertEvent;
import com.pricetracker.scraper.infrastructure.db.alert.AlertEventRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface AlertEventRowMapper {

    @Mapping(target = "userId", source = "subscriberId")
    @Mapping(target = "productId", source = "itemId")
    @Mapping(target = "alertType", source = "kind")
    @Mapping(target = "thresholdValue", source = "threshold")
    @Mapping(target = "priceChangePercent", source = "percentChange")
    @Mapping(target = "notificationMethod", source = "deliveryMethod")
    @Mapping(target = "errorMessage", source = "errorSummary")
    @Mapping(target = "sent", ignore = true)
    @Mapping(target = "sentAt", ignore = true)
    AlertEventRow toRow(AlertEvent event);
}
