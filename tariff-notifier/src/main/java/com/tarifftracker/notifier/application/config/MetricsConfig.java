package com.tarifftracker.notifier.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter notificationsSentCounter(MeterRegistry registry) {
        return Counter.builder("tariff.notifications.sent")
                .description("Savings notifications delivered")
                .register(registry);
    }

    @Bean
    public Counter notificationsFailedCounter(MeterRegistry registry) {
        return Counter.builder("tariff.notifications.failed")
                .description("Savings notifications not delivered, retried next cycle")
                .register(registry);
    }

    @Bean
    public Counter notificationsSkippedCounter(MeterRegistry registry) {
        return Counter.builder("tariff.notifications.skipped")
                .description("Users whose current offer state was already notified")
                .register(registry);
    }

    @Bean
    public Counter updatesAcceptedCounter(MeterRegistry registry) {
        return Counter.builder("tariff.updates.accepted")
                .description("Pending tariff updates applied by the user")
                .register(registry);
    }

    @Bean
    public Counter updatesDeclinedCounter(MeterRegistry registry) {
        return Counter.builder("tariff.updates.declined")
                .description("Pending tariff updates discarded by the user")
                .register(registry);
    }
}
