package com.pricetracker.common.event;

public enum ItemStatus {
    ACTIVE,
    PAUSED,
    ERROR,
    DISCONTINUED
}
