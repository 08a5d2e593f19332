package com.tarifftracker.notifier.infrastructure.offer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Layout of {@code current_rates.json} as written by the ingestion job: service, then kind
 * ({@code fissa}/{@code variabile}), then band ({@code monoraria}/{@code bioraria}/{@code trioraria}).
 */
record OfferFile(
        @JsonProperty("luce") Map<String, Map<String, Rate>> electricity,
        @JsonProperty("gas") Map<String, Map<String, Rate>> gas,
        @JsonProperty("data_fonte_xml") LocalDate sourceDate
) {

    record Rate(
            @JsonProperty("energia") BigDecimal energy,
            @JsonProperty("commercializzazione") BigDecimal commercialization,
            @JsonProperty("cod_offerta") String offerCode
    ) {
    }
}
