package com.tarifftracker.notifier.domain.profile;

import com.tarifftracker.notifier.domain.tariff.TariffProfile;

import java.util.List;
import java.util.Optional;

/**
 * Durable user profiles. Implementations signal storage failures with
 * {@link com.tarifftracker.notifier.domain.exceptions.PersistenceException}.
 */
public interface ProfileStore {

    Optional<TariffProfile> get(String userId);

    void put(TariffProfile profile);

    List<TariffProfile> findAll();

    void delete(String userId);
}
