package com.tarifftracker.notifier.domain.tariff;

import java.util.Arrays;

/**
 * Every (kind, band) combination a tariff or an offer can have. Offers are indexed by plan, so a
 * tariff can only ever be looked up against an offer of its own kind and band.
 */
public enum TariffPlan {
    FIXED_SINGLE(TariffKind.FIXED, TariffBand.SINGLE),
    FIXED_TWO_TIER(TariffKind.FIXED, TariffBand.TWO_TIER),
    FIXED_THREE_TIER(TariffKind.FIXED, TariffBand.THREE_TIER),
    VARIABLE_SINGLE(TariffKind.VARIABLE, TariffBand.SINGLE),
    VARIABLE_TWO_TIER(TariffKind.VARIABLE, TariffBand.TWO_TIER),
    VARIABLE_THREE_TIER(TariffKind.VARIABLE, TariffBand.THREE_TIER);

    private final TariffKind kind;
    private final TariffBand band;

    TariffPlan(TariffKind kind, TariffBand band) {
        this.kind = kind;
        this.band = band;
    }

    public TariffKind kind() {
        return kind;
    }

    public TariffBand band() {
        return band;
    }

    public static TariffPlan of(TariffKind kind, TariffBand band) {
        return Arrays.stream(values())
                .filter(plan -> plan.kind == kind && plan.band == band)
                .findFirst()
                .orElseThrow();
    }
}
