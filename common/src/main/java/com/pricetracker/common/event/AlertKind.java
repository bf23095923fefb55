package com.pricetracker.common.event;

public enum AlertKind {
    PRICE_DROP,
    PRICE_INCREASE,
    BACK_IN_STOCK,
    NEW_LOW
}
