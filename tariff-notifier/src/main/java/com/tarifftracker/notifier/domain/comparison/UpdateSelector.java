package com.tarifftracker.notifier.domain.comparison;

import com.tarifftracker.notifier.domain.offer.CurrentOfferSnapshot;
import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Picks the services worth proposing as a one-tap update. A service with savings and no worsened
 * field always qualifies; a mixed service only when the consumption-based estimate is a net gain.
 */
@Component
@RequiredArgsConstructor
public class UpdateSelector {

    private final EstimatedSavingsCalculator savingsCalculator;

    public Set<Service> select(TariffProfile profile, AggregateSavings aggregate, CurrentOfferSnapshot snapshot) {
        var selected = EnumSet.noneOf(Service.class);
        for (var service : Service.values()) {
            aggregate.result(service)
                    .filter(ComparisonResult::hasImprovement)
                    .filter(result -> !result.isMixed() || isNetGain(profile, service, snapshot))
                    .ifPresent(result -> selected.add(service));
        }
        return selected;
    }

    private boolean isNetGain(TariffProfile profile, Service service, CurrentOfferSnapshot snapshot) {
        return savingsCalculator.estimate(profile, service, snapshot)
                .map(saving -> saving.signum() > 0)
                .orElse(false);
    }
}
