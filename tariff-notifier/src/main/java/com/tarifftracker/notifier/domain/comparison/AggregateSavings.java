package com.tarifftracker.notifier.domain.comparison;

import com.tarifftracker.notifier.domain.tariff.Service;

import java.util.Optional;

/**
 * Per-service comparison results for one profile. {@code gas} is null when the user has no gas supply.
 */
public record AggregateSavings(
        ComparisonResult electricity,
        ComparisonResult gas,
        boolean hasSavings,
        boolean isMixed
) {

    public static AggregateSavings of(ComparisonResult electricity, ComparisonResult gas) {
        boolean hasSavings = electricity.hasImprovement() || (gas != null && gas.hasImprovement());
        boolean mixed = electricity.isMixed() || (gas != null && gas.isMixed());
        return new AggregateSavings(electricity, gas, hasSavings, mixed);
    }

    public Optional<ComparisonResult> result(Service service) {
        return switch (service) {
            case ELECTRICITY -> Optional.of(electricity);
            case GAS -> Optional.ofNullable(gas);
        };
    }

    public boolean hasSavings(Service service) {
        return result(service).map(ComparisonResult::hasImprovement).orElse(false);
    }
}
