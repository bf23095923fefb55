package com.pricetracker.scraper.domain.extraction;

import com.pricetracker.common.event.Marketplace;
import com.pricetracker.scraper.domain.exceptions.ExtractionException;
import java.net.URI;

public interface MarketplaceExtractor {

    Marketplace marketplace();

    /**
     * Fetches the listing page through {@code transport} and parses it.
     *
     * @throws ExtractionException when the page cannot be fetched or carries no usable price
     */
    ExtractedListing extract(URI url, PageTransport transport);
}
