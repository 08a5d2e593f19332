package com.tarifftracker.notifier.domain.tariff;

import com.tarifftracker.notifier.domain.notification.NotifiedSnapshot;
import lombok.Builder;

import java.util.Objects;
import java.util.Optional;

@Builder(toBuilder = true)
public record TariffProfile(
        String userId,
        Tariff electricity,
        Tariff gas,
        NotifiedSnapshot lastNotifiedSnapshot
) {

    public TariffProfile {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(electricity, "electricity");
        requireSupported(Service.ELECTRICITY, electricity);
        if (gas != null) {
            requireSupported(Service.GAS, gas);
        }
    }

    public boolean hasGas() {
        return gas != null;
    }

    public Optional<Tariff> tariff(Service service) {
        return switch (service) {
            case ELECTRICITY -> Optional.of(electricity);
            case GAS -> Optional.ofNullable(gas);
        };
    }

    public TariffProfile withTariff(Service service, Tariff tariff) {
        return switch (service) {
            case ELECTRICITY -> toBuilder().electricity(tariff).build();
            case GAS -> toBuilder().gas(tariff).build();
        };
    }

    public TariffProfile withLastNotifiedSnapshot(NotifiedSnapshot snapshot) {
        return toBuilder().lastNotifiedSnapshot(snapshot).build();
    }

    private static void requireSupported(Service service, Tariff tariff) {
        if (!service.supports(tariff.plan())) {
            throw new IllegalArgumentException(service + " does not support plan " + tariff.plan());
        }
        tariff.consumption().keySet().stream()
                .filter(slot -> !service.supports(slot))
                .findAny()
                .ifPresent(slot -> {
                    throw new IllegalArgumentException(service + " does not record consumption slot " + slot);
                });
    }
}
