package com.tarifftracker.notifier.domain.pending;

import com.tarifftracker.notifier.domain.tariff.ConsumptionSlot;
import com.tarifftracker.notifier.domain.tariff.Tariff;
import com.tarifftracker.notifier.domain.tariff.TariffPlan;

import java.math.BigDecimal;
import java.util.Map;

public record FragmentEntry(
        TariffPlan plan,
        BigDecimal energyRate,
        BigDecimal commercializationFee,
        Map<ConsumptionSlot, BigDecimal> consumption
) {

    public FragmentEntry {
        consumption = consumption == null ? Map.of() : Map.copyOf(consumption);
    }

    static FragmentEntry unchanged(Tariff tariff) {
        return new FragmentEntry(tariff.plan(), tariff.energyRate(), tariff.commercializationFee(), tariff.consumption());
    }
}
