package com.pricetracker.scraper.domain.exceptions;

import com.pricetracker.common.event.Marketplace;

public class PageParseException extends ExtractionException {

    private final Marketplace marketplace;

    private PageParseException(Marketplace marketplace, String message) {
        super(message);
        this.marketplace = marketplace;
    }

    public static PageParseException missingPrice(Marketplace marketplace) {
        return new PageParseException(marketplace, "No price found on " + marketplace + " page");
    }

    public static PageParseException negativePrice(Marketplace marketplace, String priceText) {
        return new PageParseException(
                marketplace, "Negative price '" + priceText + "' on " + marketplace + " page");
    }

    public Marketplace marketplace() {
        return marketplace;
    }
}
