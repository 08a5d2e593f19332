package com.tarifftracker.notifier.domain.offer;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One published offer for a (service, plan). {@code offerCode} is the registry code, when known.
 */
@Builder(toBuilder = true)
public record OfferEntry(
        BigDecimal energyRate,
        BigDecimal commercializationFee,
        String offerCode
) {

    public OfferEntry {
        Objects.requireNonNull(energyRate, "energyRate");
        Objects.requireNonNull(commercializationFee, "commercializationFee");
    }
}
