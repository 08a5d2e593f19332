package com.tarifftracker.notifier.domain.tariff;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A subscribed tariff. {@code energyRate} is a unit price for fixed plans and a spread over the
 * market index for variable ones; {@code commercializationFee} is the yearly supplier fee.
 */
@Builder(toBuilder = true)
public record Tariff(
        TariffPlan plan,
        BigDecimal energyRate,
        BigDecimal commercializationFee,
        Map<ConsumptionSlot, BigDecimal> consumption
) {

    public Tariff {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(energyRate, "energyRate");
        Objects.requireNonNull(commercializationFee, "commercializationFee");
        if (energyRate.signum() < 0 || commercializationFee.signum() < 0) {
            throw new IllegalArgumentException("Tariff rates must be non-negative");
        }
        consumption = consumption == null || consumption.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(consumption));
    }

    public Tariff withPricing(BigDecimal newEnergyRate, BigDecimal newCommercializationFee) {
        return toBuilder()
                .energyRate(newEnergyRate)
                .commercializationFee(newCommercializationFee)
                .build();
    }

    /** Sum of all recorded slots, or {@code null} when no consumption was recorded. */
    public BigDecimal totalConsumption() {
        if (consumption.isEmpty()) {
            return null;
        }
        return consumption.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
