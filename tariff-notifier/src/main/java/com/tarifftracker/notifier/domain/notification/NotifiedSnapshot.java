package com.tarifftracker.notifier.domain.notification;

import com.tarifftracker.notifier.domain.tariff.Service;

import java.util.Map;

/**
 * Offer rates of the last notification sent to a user, per service. Compared by exact equality:
 * only the most recent snapshot is remembered.
 */
public record NotifiedSnapshot(Map<Service, NotifiedRate> rates) {

    public NotifiedSnapshot {
        rates = rates == null ? Map.of() : Map.copyOf(rates);
    }
}
