package com.pricetracker.scraper.domain.exceptions;

import java.net.URI;

public class TransientFetchException extends ExtractionException {

    private TransientFetchException(String message) {
        super(message);
    }

    private TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TransientFetchException status(URI url, int statusCode) {
        return new TransientFetchException("HTTP " + statusCode + " from " + url.getHost());
    }

    public static TransientFetchException timeout(URI url) {
        return new TransientFetchException("Timed out fetching " + url.getHost());
    }

    public static TransientFetchException of(URI url, Throwable cause) {
        return new TransientFetchException(
                "Fetch failed for " + url.getHost() + ": " + cause.getMessage(), cause);
    }
}
