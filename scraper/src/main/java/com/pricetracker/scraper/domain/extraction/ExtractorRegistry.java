package com.pricetracker.scraper.domain.extraction;

import com.pricetracker.common.event.Marketplace;
import com.pricetracker.scraper.domain.exceptions.UnsupportedMarketplaceException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ExtractorRegistry {

    private final Map<Marketplace, MarketplaceExtractor> extractors = new EnumMap<>(Marketplace.class);

    public ExtractorRegistry(List<MarketplaceExtractor> extractors) {
        for (var extractor : extractors) {
            var previous = this.extractors.put(extractor.marketplace(), extractor);
            if (previous != null) {
                throw new IllegalStateException(
                        "Two extractors registered for " + extractor.marketplace() + ": "
                                + previous.getClass().getSimpleName() + ", "
                                + extractor.getClass().getSimpleName());
            }
        }
        log.info("Registered extractors for {}", this.extractors.keySet());
    }

    public MarketplaceExtractor forMarketplace(Marketplace marketplace) {
        var extractor = extractors.get(marketplace);
        if (extractor == null) {
            throw UnsupportedMarketplaceException.of(marketplace);
        }
        return extractor;
    }

    public Set<Marketplace> supported() {
        return Collections.unmodifiableSet(extractors.keySet());
    }
}
