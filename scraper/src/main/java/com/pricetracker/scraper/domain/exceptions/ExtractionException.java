package com.pricetracker.scraper.domain.exceptions;

/**
 * Base type for failures of a single fetch attempt. Always counts against the item and the
 * proxy that served it.
 */
public abstract class ExtractionException extends RuntimeException {

    protected ExtractionException(String message) {
        super(message);
    }

    protected ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
