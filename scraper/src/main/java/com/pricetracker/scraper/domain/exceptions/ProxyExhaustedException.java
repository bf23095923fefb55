package com.pricetracker.scraper.domain.exceptions;

public class ProxyExhaustedException extends RuntimeException {

    private ProxyExhaustedException(String message) {
        super(message);
    }

    public static ProxyExhaustedException of(int knownEndpoints) {
        return new ProxyExhaustedException(
                "No eligible proxy among " + knownEndpoints + " known endpoints");
    }
}
