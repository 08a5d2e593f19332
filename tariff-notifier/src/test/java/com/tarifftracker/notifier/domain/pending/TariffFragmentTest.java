package com.tarifftracker.notifier.domain.pending;

import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.SOME_INSTANT;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.SOME_USER_ID;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.electricityWithConsumption;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.profileBuilder;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.tariff;
import static org.assertj.core.api.Assertions.assertThat;

import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffPlan;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TariffFragmentTest {

    private static TariffFragment electricityProposal(TariffPlan plan) {
        var entry = new FragmentEntry(plan, new BigDecimal("0.120"), new BigDecimal("50"), Map.of());
        return new TariffFragment("01JAAAAAAAAAAAAAAAAAAAAAAA", SOME_USER_ID,
                Map.of(Service.ELECTRICITY, entry), Set.of(Service.ELECTRICITY), SOME_INSTANT);
    }

    @Test
    void shouldApplyRatesOnTopOfLiveProfile() {
        // given consumption was recorded after the proposal was built
        var live = profileBuilder()
                .electricity(electricityWithConsumption(TariffPlan.FIXED_SINGLE, "0.145", "72", "10", "20", "30"))
                .gas(tariff(TariffPlan.FIXED_SINGLE, "0.40", "90"))
                .build();

        // when
        var merged = electricityProposal(TariffPlan.FIXED_SINGLE).applyTo(live);

        // then
        assertThat(merged.electricity().energyRate()).isEqualByComparingTo("0.120");
        assertThat(merged.electricity().commercializationFee()).isEqualByComparingTo("50");
        assertThat(merged.electricity().consumption()).isEqualTo(live.electricity().consumption());
        assertThat(merged.gas()).isEqualTo(live.gas());
    }

    @Test
    void shouldKeepServiceWhoseLivePlanChanged() {
        // given
        var live = profileBuilder()
                .electricity(tariff(TariffPlan.VARIABLE_SINGLE, "0.02", "72"))
                .build();

        // when
        var merged = electricityProposal(TariffPlan.FIXED_SINGLE).applyTo(live);

        // then
        assertThat(merged).isEqualTo(live);
    }

    @Test
    void shouldIgnoreServiceRemovedFromLiveProfile() {
        // given
        var gasEntry = new FragmentEntry(TariffPlan.FIXED_SINGLE, new BigDecimal("0.30"), new BigDecimal("60"), Map.of());
        var fragment = new TariffFragment("01JAAAAAAAAAAAAAAAAAAAAAAA", SOME_USER_ID,
                Map.of(Service.GAS, gasEntry), Set.of(Service.GAS), SOME_INSTANT);
        var live = profileBuilder().build();

        // when
        var merged = fragment.applyTo(live);

        // then
        assertThat(merged.hasGas()).isFalse();
        assertThat(merged).isEqualTo(live);
    }
}
