package com.tarifftracker.notifier.domain.notification;

import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.OFFERS_PAGE_URL;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.SOME_OFFER_CODE;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.electricityOffer;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.electricityWithConsumption;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.offer;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.profileBuilder;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.snapshotBuilder;
import static com.tarifftracker.notifier.test.fixtures.TariffFixtures.tariff;
import static org.assertj.core.api.Assertions.assertThat;

import com.tarifftracker.notifier.domain.comparison.EstimatedSavingsCalculator;
import com.tarifftracker.notifier.domain.comparison.RateComparator;
import com.tarifftracker.notifier.domain.comparison.SavingsAggregator;
import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffPlan;
import org.junit.jupiter.api.Test;

class NotificationFormatterTest {

    private final SavingsAggregator aggregator = new SavingsAggregator(new RateComparator());
    private final NotificationFormatter formatter =
            new NotificationFormatter(new EstimatedSavingsCalculator(), OFFERS_PAGE_URL);

    @Test
    void shouldRenderGoodNewsWithBoldImprovedValues() {
        // given
        var profile = profileBuilder().build();
        var snapshot = electricityOffer(TariffPlan.FIXED_SINGLE, "0.130", "60");

        // when
        var text = formatter.format(profile, aggregator.evaluate(profile, snapshot), snapshot, true);

        // then
        assertThat(text)
                .startsWith("⚡").contains("<b>Good news!</b>")
                .contains("💡 <b>Electricity (Fixed Single rate):</b>")
                .contains("Your tariff: Fixed price 0,145 €/kWh, Fee 72 €/year")
                .contains("New tariff: Fixed price <b>0,13 €/kWh</b>, Fee <b>60 €/year</b>")
                .contains("📋 Offer code: <code>" + SOME_OFFER_CODE + "</code>")
                .contains("🔗 More info: " + OFFERS_PAGE_URL)
                .doesNotContain("📊")
                .endsWith(NotificationFormatter.UPDATE_PROMPT);
    }

    @Test
    void shouldEscapeMarkupInOfferCode() {
        // given
        var profile = profileBuilder().build();
        var snapshot = snapshotBuilder()
                .offer(Service.ELECTRICITY, TariffPlan.FIXED_SINGLE,
                        offer("0.130", "60").toBuilder().offerCode("FLEX<1>&CO").build())
                .build();

        // when
        var text = formatter.format(profile, aggregator.evaluate(profile, snapshot), snapshot, false);

        // then
        assertThat(text)
                .contains("📋 Offer code: <code>FLEX&lt;1&gt;&amp;CO</code>")
                .doesNotContain("FLEX<1>");
    }

    @Test
    void shouldUnderlineWorsenedValueAndAddAdviceWhenMixed() {
        // given
        var profile = profileBuilder().build();
        var snapshot = electricityOffer(TariffPlan.FIXED_SINGLE, "0.130", "80");

        // when
        var text = formatter.format(profile, aggregator.evaluate(profile, snapshot), snapshot, false);

        // then
        assertThat(text)
                .startsWith("⚖").contains("<b>Tariff update</b>")
                .contains("New tariff: Fixed price <b>0,13 €/kWh</b>, Fee <u>80 €/year</u>")
                .contains("📊")
                .doesNotContain(NotificationFormatter.UPDATE_PROMPT);
    }

    @Test
    void shouldShowEstimatedSavingOrExtraCost() {
        // given
        var profile = profileBuilder()
                .electricity(electricityWithConsumption(TariffPlan.FIXED_THREE_TIER, "0.145", "72", "1000", "900", "800"))
                .build();
        var cheaper = electricityOffer(TariffPlan.FIXED_THREE_TIER, "0.130", "80");
        var dearer = electricityOffer(TariffPlan.FIXED_THREE_TIER, "0.144", "80");

        // when
        var saving = formatter.format(profile, aggregator.evaluate(profile, cheaper), cheaper, false);
        var extraCost = formatter.format(profile, aggregator.evaluate(profile, dearer), dearer, false);

        // then
        assertThat(saving).contains("💰 Estimated saving: <b>32,50 €/year</b>");
        assertThat(extraCost).contains("💸 Estimated extra cost: 5,30 €/year");
    }

    @Test
    void shouldRenderOnlyServicesWithSavingsUsingServiceUnits() {
        // given
        var profile = profileBuilder()
                .gas(tariff(TariffPlan.VARIABLE_SINGLE, "0.10", "90"))
                .build();
        var snapshot = snapshotBuilder()
                .offer(Service.ELECTRICITY, TariffPlan.FIXED_SINGLE, offer("0.150", "72"))
                .offer(Service.GAS, TariffPlan.VARIABLE_SINGLE, offer("0.08", "80"))
                .build();

        // when
        var text = formatter.format(profile, aggregator.evaluate(profile, snapshot), snapshot, false);

        // then
        assertThat(text)
                .doesNotContain("💡")
                .contains("🔥 <b>Gas (Variable Single rate):</b>")
                .contains("Your tariff: Spread (PSV +) 0,10 €/Smc, Fee 90 €/year");
    }
}
