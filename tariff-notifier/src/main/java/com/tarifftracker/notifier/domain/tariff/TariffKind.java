package com.tarifftracker.notifier.domain.tariff;

public enum TariffKind {
    /** Flat per-unit price. */
    FIXED,
    /** Spread added to a published market index. */
    VARIABLE
}
