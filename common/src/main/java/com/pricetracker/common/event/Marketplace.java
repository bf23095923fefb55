package com.pricetracker.common.event;

public enum Marketplace {
    AMAZON,
    EBAY,
    ALIEXPRESS
}
