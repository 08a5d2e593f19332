package com.tarifftracker.notifier.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "notifier")
public record NotifierProperties(
        @NotNull @Valid Check check,
        @NotNull @Valid Dispatch dispatch,
        @NotNull @Valid Offers offers,
        @NotNull @Valid Links links) {

    public record Check(@NotBlank String cron, @NotBlank String timezone) {}

    /** Worker count for message delivery; bounded to stay under the provider's rate limit. */
    public record Dispatch(@Min(1) @Max(30) int maxConcurrency) {}

    public record Offers(@NotBlank String file) {}

    public record Links(@NotBlank String offersPage) {}
}
