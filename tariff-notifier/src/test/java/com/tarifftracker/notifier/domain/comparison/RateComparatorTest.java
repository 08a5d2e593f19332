package com.tarifftracker.notifier.domain.comparison;

import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.offer;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.tariff;
import static org.assertj.core.api.Assertions.assertThat;

import com.tarifftracker.notifier.domain.tariff.TariffPlan;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class RateComparatorTest {

    private final RateComparator comparator = new RateComparator();

    @Test
    void shouldReportEnergySavingAndWorsenedFeeForMixedOffer() {
        // given
        var userTariff = tariff(TariffPlan.FIXED_SINGLE, "0.145", "72.0");

        // when
        var result = comparator.compare(userTariff, offer("0.130", "80.0"));

        // then
        var expected = ComparisonResult.builder()
                .plan(TariffPlan.FIXED_SINGLE)
                .available(true)
                .energySaving(new FieldSaving(new BigDecimal("0.145"), new BigDecimal("0.130"), new BigDecimal("0.015")))
                .commFeeWorsened(true)
                .build();
        assertThat(result)
                .usingRecursiveComparison()
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .isEqualTo(expected);
        assertThat(result.isMixed()).isTrue();
    }

    @Test
    void shouldReportNothingWhenRatesAreEqualAtDifferentScale() {
        // given
        var userTariff = tariff(TariffPlan.VARIABLE_SINGLE, "0.0100", "72");

        // when
        var result = comparator.compare(userTariff, offer("0.01", "72.00"));

        // then
        assertThat(result.available()).isTrue();
        assertThat(result.hasImprovement()).isFalse();
        assertThat(result.hasWorsening()).isFalse();
    }

    @Test
    void shouldReportUnavailableWhenNoOfferExists() {
        // when
        var result = comparator.compare(tariff(TariffPlan.FIXED_SINGLE, "0.145", "72.0"), null);

        // then
        assertThat(result).isEqualTo(ComparisonResult.unavailable(TariffPlan.FIXED_SINGLE));
        assertThat(result.hasImprovement()).isFalse();
        assertThat(result.hasWorsening()).isFalse();
    }

    @Test
    void shouldReportBothSavingsWithPositiveDeltas() {
        // when
        var result = comparator.compare(tariff(TariffPlan.FIXED_SINGLE, "0.10", "90.0"), offer("0.08", "80.0"));

        // then
        assertThat(result.energy()).hasValueSatisfying(saving ->
                assertThat(saving.delta()).isEqualByComparingTo("0.02"));
        assertThat(result.commFee()).hasValueSatisfying(saving ->
                assertThat(saving.delta()).isEqualByComparingTo("10"));
        assertThat(result.isMixed()).isFalse();
    }

    @Test
    void shouldReportWorseningOnlyWhenOfferIsMoreExpensive() {
        // when
        var result = comparator.compare(tariff(TariffPlan.FIXED_SINGLE, "0.10", "60"), offer("0.12", "70"));

        // then
        assertThat(result.hasImprovement()).isFalse();
        assertThat(result.energyWorsened()).isTrue();
        assertThat(result.commFeeWorsened()).isTrue();
        assertThat(result.isMixed()).isFalse();
    }
}
