package com.tarifftracker.notifier.domain.tariff;

import java.util.EnumSet;
import java.util.Set;

public enum Service {
    ELECTRICITY(EnumSet.allOf(TariffBand.class), EnumSet.of(ConsumptionSlot.F1, ConsumptionSlot.F2, ConsumptionSlot.F3)),
    GAS(EnumSet.of(TariffBand.SINGLE, TariffBand.TWO_TIER), EnumSet.of(ConsumptionSlot.ANNUAL));

    private final Set<TariffBand> bands;
    private final Set<ConsumptionSlot> consumptionSlots;

    Service(Set<TariffBand> bands, Set<ConsumptionSlot> consumptionSlots) {
        this.bands = bands;
        this.consumptionSlots = consumptionSlots;
    }

    public boolean supports(TariffPlan plan) {
        return bands.contains(plan.band());
    }

    public boolean supports(ConsumptionSlot slot) {
        return consumptionSlots.contains(slot);
    }
}
