package com.tarifftracker.notifier.domain.comparison;

import com.tarifftracker.notifier.domain.offer.CurrentOfferSnapshot;
import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Yearly saving of switching one service to the offer of its plan, based on the consumption the
 * user recorded: {@code (userRate - offerRate) * totalConsumption + (userFee - offerFee)}.
 * Negative when the offer would cost more. Empty without consumption data or without an offer.
 */
@Component
public class EstimatedSavingsCalculator {

    public Optional<BigDecimal> estimate(TariffProfile profile, Service service, CurrentOfferSnapshot snapshot) {
        return profile.tariff(service).flatMap(tariff -> {
            var consumption = tariff.totalConsumption();
            if (consumption == null) {
                return Optional.empty();
            }
            return snapshot.offer(service, tariff.plan()).map(offer -> tariff.energyRate()
                    .subtract(offer.energyRate())
                    .multiply(consumption)
                    .add(tariff.commercializationFee().subtract(offer.commercializationFee())));
        });
    }
}
