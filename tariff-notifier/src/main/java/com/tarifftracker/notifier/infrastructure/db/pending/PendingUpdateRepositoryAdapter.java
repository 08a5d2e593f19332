package com.tarifftracker.notifier.infrastructure.db.pending;

import com.tarifftracker.common.json.JacksonConfig;
import com.tarifftracker.notifier.domain.exceptions.PersistenceException;
import com.tarifftracker.notifier.domain.pending.PendingUpdateStore;
import com.tarifftracker.notifier.domain.pending.TariffFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class PendingUpdateRepositoryAdapter implements PendingUpdateStore {

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private final PendingUpdateJpaRepository jpaRepository;

    @Override
    @Transactional
    public void save(String userId, TariffFragment fragment) {
        try {
            jpaRepository.upsert(PendingUpdateEntity.builder()
                    .userId(userId)
                    .fragmentId(fragment.id())
                    .fragment(objectMapper.writeValueAsString(fragment))
                    .createdAt(fragment.createdAt())
                    .build());
        } catch (DataAccessException | JacksonException ex) {
            throw PersistenceException.of("save pending update", userId, ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TariffFragment> load(String userId) {
        try {
            return jpaRepository.findById(userId)
                    .map(row -> objectMapper.readValue(row.getFragment(), TariffFragment.class));
        } catch (DataAccessException | JacksonException ex) {
            throw PersistenceException.of("load pending update", userId, ex);
        }
    }

    @Override
    @Transactional
    public void clear(String userId) {
        try {
            var removed = jpaRepository.deleteByUserIdNative(userId);
            log.debug("pending.cleared: user_id={}, removed={}", userId, removed);
        } catch (DataAccessException ex) {
            throw PersistenceException.of("clear pending update", userId, ex);
        }
    }
}
