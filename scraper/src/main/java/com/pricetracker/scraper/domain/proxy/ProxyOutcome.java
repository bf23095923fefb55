package com.pricetracker.scraper.domain.proxy;

public enum ProxyOutcome {
    SUCCESS,
    FAILURE
}
