package com.tarifftracker.notifier.infrastructure.db.profile;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TariffProfileJpaRepository extends JpaRepository<TariffProfileEntity, String> {
}
