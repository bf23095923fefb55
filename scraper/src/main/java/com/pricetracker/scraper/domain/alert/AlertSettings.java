package com.pricetracker.scraper.domain.alert;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;

@Builder(toBuilder = true)
public record AlertSettings(BigDecimal dropRatio, BigDecimal increaseRatio, Duration channelTimeout) {

    public static AlertSettingsBuilder defaults() {
        return AlertSettings.builder()
                .dropRatio(new BigDecimal("0.10"))
                .channelTimeout(Duration.ofSeconds(30));
    }
}
