package com.tarifftracker.notifier.domain.comparison;

import com.tarifftracker.notifier.domain.tariff.TariffPlan;
import lombok.Builder;

import java.util.Optional;

/**
 * Outcome of comparing one tariff against the offer of the same plan. {@code available} is false
 * when no offer is published for the plan; such a result carries no saving and no worsening.
 */
@Builder
public record ComparisonResult(
        TariffPlan plan,
        boolean available,
        FieldSaving energySaving,
        FieldSaving commFeeSaving,
        boolean energyWorsened,
        boolean commFeeWorsened
) {

    public static ComparisonResult unavailable(TariffPlan plan) {
        return ComparisonResult.builder().plan(plan).available(false).build();
    }

    public Optional<FieldSaving> energy() {
        return Optional.ofNullable(energySaving);
    }

    public Optional<FieldSaving> commFee() {
        return Optional.ofNullable(commFeeSaving);
    }

    public boolean hasImprovement() {
        return energySaving != null || commFeeSaving != null;
    }

    public boolean hasWorsening() {
        return energyWorsened || commFeeWorsened;
    }

    public boolean isMixed() {
        return hasImprovement() && hasWorsening();
    }
}
