package com.pricetracker.scraper.domain.tracking;

import java.math.BigDecimal;
import java.math.MathContext;
import lombok.Builder;

/**
 * Running price statistics of a tracked item. The average is maintained incrementally,
 * {@code newAvg = (oldAvg * (n - 1) + price) / n}.
 */
@Builder(toBuilder = true)
public record PriceStatistics(
        BigDecimal currentPrice,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        BigDecimal avgPrice,
        int checkCount) {

    public static PriceStatistics empty() {
        return new PriceStatistics(null, null, null, null, 0);
    }

    public PriceStatistics accept(BigDecimal price) {
        var count = checkCount + 1;
        var average = avgPrice == null || checkCount == 0
                ? price
                : avgPrice.multiply(BigDecimal.valueOf(checkCount), MathContext.DECIMAL64)
                        .add(price, MathContext.DECIMAL64)
                        .divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
        return new PriceStatistics(
                price,
                minPrice == null || price.compareTo(minPrice) < 0 ? price : minPrice,
                maxPrice == null || price.compareTo(maxPrice) > 0 ? price : maxPrice,
                average,
                count);
    }
}
