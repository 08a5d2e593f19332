package com.tarifftracker.notifier.domain.pending;

import com.tarifftracker.common.id.UlidGenerator;
import com.tarifftracker.notifier.domain.offer.CurrentOfferSnapshot;
import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Set;

/**
 * Builds the fragment proposed alongside a notification. Selected services take the rates of the
 * offer for their own plan; all other services and every consumption value are copied verbatim.
 */
@Component
@RequiredArgsConstructor
public class PendingUpdateBuilder {

    private final Clock clock;

    public TariffFragment build(TariffProfile profile, CurrentOfferSnapshot snapshot, Set<Service> updateServices) {
        var entries = new EnumMap<Service, FragmentEntry>(Service.class);
        var selected = EnumSet.noneOf(Service.class);

        for (var service : Service.values()) {
            profile.tariff(service).ifPresent(tariff -> {
                var offer = updateServices.contains(service)
                        ? snapshot.offer(service, tariff.plan()).orElse(null)
                        : null;
                if (offer == null) {
                    entries.put(service, FragmentEntry.unchanged(tariff));
                    return;
                }
                entries.put(service, new FragmentEntry(
                        tariff.plan(), offer.energyRate(), offer.commercializationFee(), tariff.consumption()));
                selected.add(service);
            });
        }

        return new TariffFragment(UlidGenerator.generate(clock), profile.userId(), entries, selected, clock.instant());
    }
}
