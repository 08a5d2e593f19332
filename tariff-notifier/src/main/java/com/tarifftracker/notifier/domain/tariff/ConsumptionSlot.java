package com.tarifftracker.notifier.domain.tariff;

/**
 * Yearly consumption buckets. Electricity uses F1..F3 (two-tier stores F1 and F23 in F2),
 * gas a single annual figure.
 */
public enum ConsumptionSlot {
    F1,
    F2,
    F3,
    ANNUAL
}
