package com.tarifftracker.notifier.infrastructure.db.profile;

import com.tarifftracker.notifier.domain.tariff.TariffPlan;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "tariff_profiles")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TariffProfileEntity {

    @Id
    @Column(name = "user_id", length = 32)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "electricity_plan", nullable = false, length = 20)
    private TariffPlan electricityPlan;

    @Column(name = "electricity_energy_rate", nullable = false, precision = 12, scale = 6)
    private BigDecimal electricityEnergyRate;

    @Column(name = "electricity_commercialization_fee", nullable = false, precision = 12, scale = 6)
    private BigDecimal electricityCommercializationFee;

    @Column(name = "electricity_consumption_f1", precision = 12, scale = 2)
    private BigDecimal electricityConsumptionF1;

    @Column(name = "electricity_consumption_f2", precision = 12, scale = 2)
    private BigDecimal electricityConsumptionF2;

    @Column(name = "electricity_consumption_f3", precision = 12, scale = 2)
    private BigDecimal electricityConsumptionF3;

    @Enumerated(EnumType.STRING)
    @Column(name = "gas_plan", length = 20)
    private TariffPlan gasPlan;

    @Column(name = "gas_energy_rate", precision = 12, scale = 6)
    private BigDecimal gasEnergyRate;

    @Column(name = "gas_commercialization_fee", precision = 12, scale = 6)
    private BigDecimal gasCommercializationFee;

    @Column(name = "gas_consumption_annual", precision = 12, scale = 2)
    private BigDecimal gasConsumptionAnnual;

    @Column(name = "last_notified_snapshot", columnDefinition = "text")
    private String lastNotifiedSnapshot;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
