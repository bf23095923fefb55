package com.pricetracker.scraper.domain.alert;

import java.math.BigDecimal;

/**
 * @param targetPrice   per-item target, null when the owner set none
 * @param dropRatio     relative drop that fires PRICE_DROP, e.g. 0.10
 * @param increaseRatio relative rise that fires PRICE_INCREASE, null to disable
 */
public record AlertThresholds(BigDecimal targetPrice, BigDecimal dropRatio, BigDecimal increaseRatio) {

    public static AlertThresholds of(BigDecimal targetPrice, AlertSettings settings) {
        return new AlertThresholds(targetPrice, settings.dropRatio(), settings.increaseRatio());
    }
}
