package com.tarifftracker.notifier.infrastructure.db.profile.mapper;

import com.tarifftracker.common.json.JacksonConfig;
import com.tarifftracker.notifier.domain.notification.NotifiedSnapshot;
import com.tarifftracker.notifier.domain.tariff.ConsumptionSlot;
import com.tarifftracker.notifier.domain.tariff.Tariff;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import com.tarifftracker.notifier.infrastructure.db.profile.TariffProfileEntity;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Flattens profiles into one row per user. The notified snapshot is stored as JSON.
 */
@Component
public class TariffProfileEntityMapper {

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public TariffProfileEntity toEntity(TariffProfile profile) {
        var electricity = profile.electricity();
        var builder = TariffProfileEntity.builder()
                .userId(profile.userId())
                .electricityPlan(electricity.plan())
                .electricityEnergyRate(electricity.energyRate())
                .electricityCommercializationFee(electricity.commercializationFee())
                .electricityConsumptionF1(electricity.consumption().get(ConsumptionSlot.F1))
                .electricityConsumptionF2(electricity.consumption().get(ConsumptionSlot.F2))
                .electricityConsumptionF3(electricity.consumption().get(ConsumptionSlot.F3));

        if (profile.hasGas()) {
            var gas = profile.gas();
            builder.gasPlan(gas.plan())
                    .gasEnergyRate(gas.energyRate())
                    .gasCommercializationFee(gas.commercializationFee())
                    .gasConsumptionAnnual(gas.consumption().get(ConsumptionSlot.ANNUAL));
        }

        if (profile.lastNotifiedSnapshot() != null) {
            builder.lastNotifiedSnapshot(objectMapper.writeValueAsString(profile.lastNotifiedSnapshot()));
        }
        return builder.build();
    }

    public TariffProfile toDomain(TariffProfileEntity entity) {
        var electricityConsumption = new EnumMap<ConsumptionSlot, BigDecimal>(ConsumptionSlot.class);
        putIfPresent(electricityConsumption, ConsumptionSlot.F1, entity.getElectricityConsumptionF1());
        putIfPresent(electricityConsumption, ConsumptionSlot.F2, entity.getElectricityConsumptionF2());
        putIfPresent(electricityConsumption, ConsumptionSlot.F3, entity.getElectricityConsumptionF3());

        var electricity = new Tariff(
                entity.getElectricityPlan(),
                entity.getElectricityEnergyRate(),
                entity.getElectricityCommercializationFee(),
                electricityConsumption);

        Tariff gas = null;
        if (entity.getGasPlan() != null) {
            var gasConsumption = new EnumMap<ConsumptionSlot, BigDecimal>(ConsumptionSlot.class);
            putIfPresent(gasConsumption, ConsumptionSlot.ANNUAL, entity.getGasConsumptionAnnual());
            gas = new Tariff(
                    entity.getGasPlan(),
                    entity.getGasEnergyRate(),
                    entity.getGasCommercializationFee(),
                    gasConsumption);
        }

        NotifiedSnapshot lastNotified = null;
        if (entity.getLastNotifiedSnapshot() != null && !entity.getLastNotifiedSnapshot().isBlank()) {
            lastNotified = objectMapper.readValue(entity.getLastNotifiedSnapshot(), NotifiedSnapshot.class);
        }

        return TariffProfile.builder()
                .userId(entity.getUserId())
                .electricity(electricity)
                .gas(gas)
                .lastNotifiedSnapshot(lastNotified)
                .build();
    }

    private static void putIfPresent(Map<ConsumptionSlot, BigDecimal> consumption, ConsumptionSlot slot, BigDecimal value) {
        if (value != null) {
            consumption.put(slot, value);
        }
    }
}
