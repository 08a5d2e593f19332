package com.tarifftracker.notifier.domain.comparison;

import com.tarifftracker.notifier.domain.offer.OfferEntry;
import com.tarifftracker.notifier.domain.tariff.Tariff;
import org.springframework.stereotype.Component;

/**
 * Field-by-field comparison of a user tariff against the offer published for the same plan.
 * Values are compared numerically, so {@code 0.130} and {@code 0.13} are equal.
 */
@Component
public class RateComparator {

    public ComparisonResult compare(Tariff userTariff, OfferEntry offer) {
        if (offer == null) {
            return ComparisonResult.unavailable(userTariff.plan());
        }

        var result = ComparisonResult.builder()
                .plan(userTariff.plan())
                .available(true);

        int energy = offer.energyRate().compareTo(userTariff.energyRate());
        if (energy < 0) {
            result.energySaving(FieldSaving.of(userTariff.energyRate(), offer.energyRate()));
        } else if (energy > 0) {
            result.energyWorsened(true);
        }

        int fee = offer.commercializationFee().compareTo(userTariff.commercializationFee());
        if (fee < 0) {
            result.commFeeSaving(FieldSaving.of(userTariff.commercializationFee(), offer.commercializationFee()));
        } else if (fee > 0) {
            result.commFeeWorsened(true);
        }

        return result.build();
    }
}
