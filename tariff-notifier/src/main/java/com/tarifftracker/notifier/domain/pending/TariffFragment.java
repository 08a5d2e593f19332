package com.tarifftracker.notifier.domain.pending;

import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * A proposed tariff change awaiting the user's answer. {@code entries} holds every subscribed
 * service as it looked when the proposal was built; only the services in {@code updateServices}
 * carry new rates and only those are applied on accept.
 */
@Slf4j
public record TariffFragment(
        String id,
        String userId,
        Map<Service, FragmentEntry> entries,
        Set<Service> updateServices,
        Instant createdAt
) {

    public TariffFragment {
        entries = entries == null ? Map.of() : Map.copyOf(entries);
        updateServices = updateServices == null ? Set.of() : Set.copyOf(updateServices);
    }

    /**
     * Overlays the selected services' rates on the live profile. Everything else, including
     * consumption and the last notified snapshot, comes from {@code live}. A selected service the
     * user has since removed or moved to another plan is left as the user set it.
     */
    public TariffProfile applyTo(TariffProfile live) {
        var merged = live;
        for (var service : updateServices) {
            var entry = entries.get(service);
            var current = live.tariff(service).orElse(null);
            if (entry == null || current == null) {
                log.info("pending.skipped: user_id={}, service={}, reason=service_removed", live.userId(), service);
                continue;
            }
            if (current.plan() != entry.plan()) {
                log.info("pending.skipped: user_id={}, service={}, reason=plan_changed, pending_plan={}, live_plan={}",
                        live.userId(), service, entry.plan(), current.plan());
                continue;
            }
            merged = merged.withTariff(service, current.withPricing(entry.energyRate(), entry.commercializationFee()));
        }
        return merged;
    }
}
