package com.tarifftracker.notifier.application.config;

import com.tarifftracker.notifier.domain.comparison.EstimatedSavingsCalculator;
import com.tarifftracker.notifier.domain.notification.NotificationFormatter;
import com.tarifftracker.notifier.infrastructure.telegram.TelegramProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({NotifierProperties.class, TelegramProperties.class})
public class NotifierConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NotificationFormatter notificationFormatter(
            EstimatedSavingsCalculator savingsCalculator, NotifierProperties properties) {
        return new NotificationFormatter(savingsCalculator, properties.links().offersPage());
    }
}
