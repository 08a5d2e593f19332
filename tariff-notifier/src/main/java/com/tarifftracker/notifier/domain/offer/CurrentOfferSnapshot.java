package com.tarifftracker.notifier.domain.offer;

import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffPlan;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The currently published best offers, keyed by service and plan. Any combination may be missing.
 */
public final class CurrentOfferSnapshot {

    private final Map<Service, Map<TariffPlan, OfferEntry>> offers;
    private final LocalDate sourceDate;

    private CurrentOfferSnapshot(Map<Service, Map<TariffPlan, OfferEntry>> offers, LocalDate sourceDate) {
        this.offers = offers;
        this.sourceDate = sourceDate;
    }

    public Optional<OfferEntry> offer(Service service, TariffPlan plan) {
        return Optional.ofNullable(offers.getOrDefault(service, Map.of()).get(plan));
    }

    public Optional<LocalDate> sourceDate() {
        return Optional.ofNullable(sourceDate);
    }

    public boolean isEmpty() {
        return offers.values().stream().allMatch(Map::isEmpty);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<Service, Map<TariffPlan, OfferEntry>> offers = new EnumMap<>(Service.class);
        private LocalDate sourceDate;

        private Builder() {
        }

        public Builder offer(Service service, TariffPlan plan, OfferEntry entry) {
            if (!service.supports(plan)) {
                throw new IllegalArgumentException(service + " offers cannot use plan " + plan);
            }
            offers.computeIfAbsent(service, s -> new EnumMap<>(TariffPlan.class)).put(plan, entry);
            return this;
        }

        public Builder sourceDate(LocalDate sourceDate) {
            this.sourceDate = sourceDate;
            return this;
        }

        public CurrentOfferSnapshot build() {
            var copy = new EnumMap<Service, Map<TariffPlan, OfferEntry>>(Service.class);
            offers.forEach((service, byPlan) ->
                    copy.put(service, Collections.unmodifiableMap(new EnumMap<>(byPlan))));
            return new CurrentOfferSnapshot(Collections.unmodifiableMap(copy), sourceDate);
        }
    }
}
