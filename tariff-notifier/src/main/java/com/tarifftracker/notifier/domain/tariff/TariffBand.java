package com.tarifftracker.notifier.domain.tariff;

public enum TariffBand {
    SINGLE,
    TWO_TIER,
    THREE_TIER
}
