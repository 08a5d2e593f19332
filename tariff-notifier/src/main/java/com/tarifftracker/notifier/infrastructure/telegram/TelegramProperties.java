package com.tarifftracker.notifier.infrastructure.telegram;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "telegram")
public record TelegramProperties(
        @NotBlank String botToken,
        @NotBlank String apiBaseUrl,
        String webhookSecret,
        @NotNull Duration connectTimeout,
        @NotNull Duration readTimeout
) {
}
