package com.tarifftracker.notifier.infrastructure.offer;

import com.tarifftracker.common.json.JacksonConfig;
import com.tarifftracker.notifier.application.config.NotifierProperties;
import com.tarifftracker.notifier.domain.offer.CurrentOfferSnapshot;
import com.tarifftracker.notifier.domain.offer.OfferEntry;
import com.tarifftracker.notifier.domain.offer.OfferSnapshotProvider;
import com.tarifftracker.notifier.domain.tariff.Service;
import com.tarifftracker.notifier.domain.tariff.TariffBand;
import com.tarifftracker.notifier.domain.tariff.TariffKind;
import com.tarifftracker.notifier.domain.tariff.TariffPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the offers file on every call so that a file replaced by the ingestion job is picked up by
 * the next sweep without a restart.
 */
@Slf4j
@Component
public class JsonFileOfferSnapshotProvider implements OfferSnapshotProvider {

    private static final Map<String, TariffKind> KINDS = Map.of(
            "fissa", TariffKind.FIXED,
            "variabile", TariffKind.VARIABLE);

    private static final Map<String, TariffBand> BANDS = Map.of(
            "monoraria", TariffBand.SINGLE,
            "bioraria", TariffBand.TWO_TIER,
            "trioraria", TariffBand.THREE_TIER);

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private final Path file;

    @Autowired
    public JsonFileOfferSnapshotProvider(NotifierProperties properties) {
        this(Path.of(properties.offers().file()));
    }

    JsonFileOfferSnapshotProvider(Path file) {
        this.file = file;
    }

    @Override
    public Optional<CurrentOfferSnapshot> current() {
        if (!Files.isRegularFile(file)) {
            log.warn("offers.missing: file={}", file);
            return Optional.empty();
        }

        OfferFile parsed;
        try {
            parsed = objectMapper.readValue(file.toFile(), OfferFile.class);
        } catch (JacksonException ex) {
            log.error("offers.unreadable: file={}, error={}", file, ex.getOriginalMessage());
            return Optional.empty();
        }
        if (parsed == null) {
            log.warn("offers.empty: file={}", file);
            return Optional.empty();
        }

        var builder = CurrentOfferSnapshot.builder().sourceDate(parsed.sourceDate());
        addService(builder, Service.ELECTRICITY, parsed.electricity());
        addService(builder, Service.GAS, parsed.gas());
        var snapshot = builder.build();

        if (snapshot.isEmpty()) {
            log.warn("offers.empty: file={}", file);
            return Optional.empty();
        }
        log.debug("offers.loaded: file={}, source_date={}", file, parsed.sourceDate());
        return Optional.of(snapshot);
    }

    private static void addService(CurrentOfferSnapshot.Builder builder, Service service,
                                   Map<String, Map<String, OfferFile.Rate>> byKind) {
        if (byKind == null) {
            return;
        }
        byKind.forEach((kindKey, byBand) -> {
            var kind = KINDS.get(kindKey);
            if (kind == null || byBand == null) {
                return;
            }
            byBand.forEach((bandKey, rate) -> {
                var band = BANDS.get(bandKey);
                if (band == null) {
                    log.warn("offers.unknown_band: service={}, band={}", service, bandKey);
                    return;
                }
                var plan = TariffPlan.of(kind, band);
                if (!service.supports(plan)) {
                    log.warn("offers.unsupported_plan: service={}, plan={}", service, plan);
                    return;
                }
                if (rate == null || rate.energy() == null || rate.commercialization() == null) {
                    log.warn("offers.incomplete: service={}, plan={}", service, plan);
                    return;
                }
                builder.offer(service, plan, OfferEntry.builder()
                        .energyRate(rate.energy())
                        .commercializationFee(rate.commercialization())
                        .offerCode(rate.offerCode())
                        .build());
            });
        });
    }
}
