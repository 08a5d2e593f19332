package com.tarifftracker.notifier.domain.notification;

import com.tarifftracker.notifier.domain.comparison.AggregateSavings;
import com.tarifftracker.notifier.domain.comparison.ComparisonResult;
import com.tarifftracker.notifier.domain.comparison.EstimatedSavingsCalculator;
import com.tarifftracker.notifier.domain.offer.CurrentOfferSnapshot;
import com.tarifftracker.notifier.domain.offer.OfferEntry;
import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.Tariff;
import com.tarifftracker.notifier.domain.tariff.TariffBand;
import com.tarifftracker.notifier.domain.tariff.TariffKind;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Renders the Telegram HTML text of a savings notification. Improved values are bold, worsened
 * ones underlined; only services with at least one saving get a section.
 */
@RequiredArgsConstructor
public class NotificationFormatter {

    public static final String UPDATE_PROMPT = "👇 Do you want to replace your registered tariffs with the new ones?";

    private final EstimatedSavingsCalculator savingsCalculator;
    private final String offersPageUrl;

    public String format(TariffProfile profile, AggregateSavings aggregate, CurrentOfferSnapshot snapshot,
                         boolean withUpdatePrompt) {
        var message = new StringBuilder(header(aggregate.isMixed()));
        for (var service : Service.values()) {
            aggregate.result(service)
                    .filter(ComparisonResult::hasImprovement)
                    .ifPresent(result -> appendSection(message, service, result, profile, snapshot));
        }
        message.append(footer(aggregate.isMixed()));
        if (withUpdatePrompt) {
            message.append("\n\n").append(UPDATE_PROMPT);
        }
        return message.toString();
    }

    private String header(boolean mixed) {
        if (mixed) {
            return "⚖️ <b>Tariff update</b>\n"
                    + "The published offer changed, but it is not necessarily cheaper: "
                    + "one component went down while the other went up.\n\n";
        }
        return "⚡️ <b>Good news!</b>\n"
                + "There is an offer cheaper than the tariff you registered.\n\n";
    }

    private void appendSection(StringBuilder message, Service service, ComparisonResult result,
                               TariffProfile profile, CurrentOfferSnapshot snapshot) {
        var tariff = profile.tariff(service).orElseThrow();
        var offer = snapshot.offer(service, tariff.plan()).orElse(null);
        if (offer == null) {
            return;
        }
        var label = rateLabel(service, tariff.plan().kind());
        var unit = energyUnit(service);

        message.append(service == Service.ELECTRICITY ? "💡" : "🔥")
                .append(" <b>").append(serviceName(service)).append(" (").append(planName(tariff)).append("):</b>\n");
        message.append("Your tariff: ").append(label).append(' ')
                .append(RateFormat.energy(tariff.energyRate())).append(' ').append(unit)
                .append(", Fee ").append(RateFormat.fee(tariff.commercializationFee())).append(" €/year\n");
        message.append("New tariff: ").append(label).append(' ')
                .append(highlight(RateFormat.energy(offer.energyRate()) + " " + unit,
                        result.energySaving() != null, result.energyWorsened()))
                .append(", Fee ")
                .append(highlight(RateFormat.fee(offer.commercializationFee()) + " €/year",
                        result.commFeeSaving() != null, result.commFeeWorsened()))
                .append('\n');
        appendOfferCode(message, offer);
        savingsCalculator.estimate(profile, service, snapshot)
                .ifPresent(estimate -> appendEstimate(message, estimate));
        message.append('\n');
    }

    private void appendOfferCode(StringBuilder message, OfferEntry offer) {
        if (offer.offerCode() != null && !offer.offerCode().isBlank()) {
            message.append("📋 Offer code: <code>").append(escapeHtml(offer.offerCode())).append("</code>\n");
        }
    }

    private void appendEstimate(StringBuilder message, BigDecimal estimate) {
        if (estimate.signum() >= 0) {
            message.append("💰 Estimated saving: <b>").append(RateFormat.fee(estimate)).append(" €/year</b>\n");
        } else {
            message.append("💸 Estimated extra cost: ").append(RateFormat.fee(estimate.negate())).append(" €/year\n");
        }
    }

    private String footer(boolean mixed) {
        var footer = new StringBuilder();
        if (mixed) {
            footer.append("📊 Whether it pays off depends on your consumption. ")
                    .append("Check it against the kWh/Smc you use in a year, you can find them on your bills.\n\n");
        }
        footer.append("🔧 You can update your registered tariffs at any time with /update.\n\n");
        footer.append("🔗 More info: ").append(offersPageUrl);
        return footer.toString();
    }

    // offer codes come from the published offers file
    private static String escapeHtml(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String highlight(String value, boolean improved, boolean worsened) {
        if (improved) {
            return "<b>" + value + "</b>";
        }
        return worsened ? "<u>" + value + "</u>" : value;
    }

    static String rateLabel(Service service, TariffKind kind) {
        if (kind == TariffKind.FIXED) {
            return "Fixed price";
        }
        return service == Service.ELECTRICITY ? "Spread (PUN +)" : "Spread (PSV +)";
    }

    static String energyUnit(Service service) {
        return service == Service.ELECTRICITY ? "€/kWh" : "€/Smc";
    }

    private static String serviceName(Service service) {
        return service == Service.ELECTRICITY ? "Electricity" : "Gas";
    }

    private static String planName(Tariff tariff) {
        var kind = tariff.plan().kind() == TariffKind.FIXED ? "Fixed" : "Variable";
        return kind + " " + bandName(tariff.plan().band());
    }

    private static String bandName(TariffBand band) {
        return switch (band) {
            case SINGLE -> "Single rate";
            case TWO_TIER -> "Two-tier";
            case THREE_TIER -> "Three-tier";
        };
    }
}
