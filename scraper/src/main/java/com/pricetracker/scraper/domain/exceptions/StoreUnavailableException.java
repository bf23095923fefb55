package com.pricetracker.scraper.domain.exceptions;

public class StoreUnavailableException extends RuntimeException {

    private StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StoreUnavailableException of(String operation, Throwable cause) {
        return new StoreUnavailableException("Item store unavailable during " + operation, cause);
    }
}
