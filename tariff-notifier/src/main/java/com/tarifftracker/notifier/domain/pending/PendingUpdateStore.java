package com.tarifftracker.notifier.domain.pending;

import java.util.Optional;

/**
 * One pending fragment per user. Saving replaces whatever was pending; clearing an empty slot
 * succeeds. Storage failures surface as
 * {@link com.tarifftracker.notifier.domain.exceptions.PersistenceException}.
 */
public interface PendingUpdateStore {

    void save(String userId, TariffFragment fragment);

    Optional<TariffFragment> load(String userId);

    void clear(String userId);
}
