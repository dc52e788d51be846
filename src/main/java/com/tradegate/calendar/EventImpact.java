package com.tradegate.calendar;

/**
 * Market impact classification of an economic calendar release.
 */
public enum EventImpact {
    LOW,
    MEDIUM,
    HIGH
}
