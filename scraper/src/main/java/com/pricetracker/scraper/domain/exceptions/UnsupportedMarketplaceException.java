package com.pricetracker.scraper.domain.exceptions;

import com.pricetracker.common.event.Marketplace;

public class UnsupportedMarketplaceException extends RuntimeException {

    private UnsupportedMarketplaceException(String message) {
        super(message);
    }

    public static UnsupportedMarketplaceException of(Marketplace marketplace) {
        return new UnsupportedMarketplaceException("No extractor registered for " + marketplace);
    }
}
