package com.tarifftracker.notifier.domain.comparison;

import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.electricityOffer;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.electricityWithConsumption;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.gasWithConsumption;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.offer;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.profileBuilder;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.snapshotBuilder;
import static org.assertj.core.api.Assertions.assertThat;

import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffPlan;
import org.junit.jupiter.api.Test;

class EstimatedSavingsCalculatorTest {

    private final EstimatedSavingsCalculator calculator = new EstimatedSavingsCalculator();

    @Test
    void shouldEstimateYearlySavingFromConsumption() {
        // given 2700 kWh at -0.015 €/kWh and 3 €/year more fee
        var profile = profileBuilder()
                .electricity(electricityWithConsumption(TariffPlan.FIXED_THREE_TIER, "0.145", "72", "1000", "900", "800"))
                .build();
        var snapshot = electricityOffer(TariffPlan.FIXED_THREE_TIER, "0.130", "75");

        // when
        var estimate = calculator.estimate(profile, Service.ELECTRICITY, snapshot);

        // then
        assertThat(estimate).hasValueSatisfying(value -> assertThat(value).isEqualByComparingTo("37.5"));
    }

    @Test
    void shouldReturnNegativeEstimateWhenOfferCostsMore() {
        // given
        var profile = profileBuilder()
                .gas(gasWithConsumption(TariffPlan.FIXED_SINGLE, "0.40", "60", "100"))
                .build();
        var snapshot = snapshotBuilder()
                .offer(Service.GAS, TariffPlan.FIXED_SINGLE, offer("0.35", "70"))
                .build();

        // when
        var estimate = calculator.estimate(profile, Service.GAS, snapshot);

        // then
        assertThat(estimate).hasValueSatisfying(value -> assertThat(value).isEqualByComparingTo("-5"));
    }

    @Test
    void shouldReturnEmptyWithoutConsumption() {
        // given
        var profile = profileBuilder().build();
        var snapshot = electricityOffer(TariffPlan.FIXED_SINGLE, "0.130", "80");

        // when / then
        assertThat(calculator.estimate(profile, Service.ELECTRICITY, snapshot)).isEmpty();
    }

    @Test
    void shouldReturnEmptyForMissingServiceOrOffer() {
        // given
        var profile = profileBuilder()
                .electricity(electricityWithConsumption(TariffPlan.FIXED_SINGLE, "0.145", "72", "1", "1", "1"))
                .build();
        var snapshot = electricityOffer(TariffPlan.VARIABLE_SINGLE, "0.01", "80");

        // when / then
        assertThat(calculator.estimate(profile, Service.ELECTRICITY, snapshot)).isEmpty();
        assertThat(calculator.estimate(profile, Service.GAS, snapshot)).isEmpty();
    }
}
