package com.tarifftracker.notifier.domain.comparison;

import com.tarifftracker.notifier.domain.offer.CurrentOfferSnapshot;
import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.Tariff;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SavingsAggregator {

    private final RateComparator comparator;

    public AggregateSavings evaluate(TariffProfile profile, CurrentOfferSnapshot snapshot) {
        var electricity = compare(Service.ELECTRICITY, profile.electricity(), snapshot);
        var gas = profile.hasGas() ? compare(Service.GAS, profile.gas(), snapshot) : null;
        return AggregateSavings.of(electricity, gas);
    }

    private ComparisonResult compare(Service service, Tariff tariff, CurrentOfferSnapshot snapshot) {
        var offer = snapshot.offer(service, tariff.plan()).orElse(null);
        return comparator.compare(tariff, offer);
    }
}
