package com.tarifftracker.notifier.domain.notification;

import com.tarifftracker.notifier.domain.comparison.AggregateSavings;
import com.tarifftracker.notifier.domain.offer.CurrentOfferSnapshot;
import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Objects;

/**
 * Decides whether an evaluation is worth a message. A user is told about a given offer state once:
 * the proposed snapshot must differ from the last one notified.
 */
@Component
public class NotificationGate {

    public boolean shouldNotify(TariffProfile profile, AggregateSavings aggregate, NotifiedSnapshot proposedSnapshot) {
        if (!aggregate.hasSavings()) {
            return false;
        }
        return !Objects.equals(proposedSnapshot, profile.lastNotifiedSnapshot());
    }

    /**
     * Offer rates for the services that have at least one saving. Services without any saving are
     * left out so that their offers moving alone never triggers a new message.
     */
    public NotifiedSnapshot proposedSnapshot(TariffProfile profile, AggregateSavings aggregate, CurrentOfferSnapshot snapshot) {
        var rates = new EnumMap<Service, NotifiedRate>(Service.class);
        for (var service : Service.values()) {
            if (!aggregate.hasSavings(service)) {
                continue;
            }
            profile.tariff(service)
                    .flatMap(tariff -> snapshot.offer(service, tariff.plan()))
                    .ifPresent(offer -> rates.put(service, NotifiedRate.of(offer)));
        }
        return new NotifiedSnapshot(rates);
    }
}
