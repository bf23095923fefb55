package com.pricetracker.scraper.domain.alert;

public enum DeliveryStatus {
    PENDING,
    SENT,
    FAILED
}
