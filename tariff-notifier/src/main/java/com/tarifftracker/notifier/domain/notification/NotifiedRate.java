package com.tarifftracker.notifier.domain.notification;

import com.tarifftracker.notifier.domain.offer.OfferEntry;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Rates of an offer the user was told about. Values are stored without trailing zeros so that
 * equality does not depend on how the offer file wrote the number.
 */
public record NotifiedRate(BigDecimal energyRate, BigDecimal commercializationFee) {

    public NotifiedRate {
        energyRate = Objects.requireNonNull(energyRate, "energyRate").stripTrailingZeros();
        commercializationFee = Objects.requireNonNull(commercializationFee, "commercializationFee").stripTrailingZeros();
    }

    public static NotifiedRate of(OfferEntry offer) {
        return new NotifiedRate(offer.energyRate(), offer.commercializationFee());
    }
}
