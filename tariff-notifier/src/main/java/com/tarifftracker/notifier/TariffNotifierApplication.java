package com.tarifftracker.notifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TariffNotifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(TariffNotifierApplication.class, args);
    }
}
