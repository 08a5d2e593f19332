package com.tarifftracker.notifier.infrastructure.db.profile;

import com.tarifftracker.notifier.domain.exceptions.PersistenceException;
import com.tarifftracker.notifier.domain.profile.ProfileStore;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import com.tarifftracker.notifier.infrastructure.db.profile.mapper.TariffProfileEntityMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class ProfileRepositoryAdapter implements ProfileStore {

    private final TariffProfileJpaRepository jpaRepository;
    private final TariffProfileEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<TariffProfile> get(String userId) {
        try {
            return jpaRepository.findById(userId).map(mapper::toDomain);
        } catch (DataAccessException | JacksonException ex) {
            throw PersistenceException.of("load profile", userId, ex);
        }
    }

    @Override
    @Transactional
    public void put(TariffProfile profile) {
        try {
            var now = clock.instant();
            var entity = mapper.toEntity(profile);
            entity.setCreatedAt(jpaRepository.findById(profile.userId())
                    .map(TariffProfileEntity::getCreatedAt)
                    .orElse(now));
            entity.setUpdatedAt(now);
            jpaRepository.save(entity);
        } catch (DataAccessException | JacksonException ex) {
            throw PersistenceException.of("save profile", profile.userId(), ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<TariffProfile> findAll() {
        List<TariffProfileEntity> rows;
        try {
            rows = jpaRepository.findAll();
        } catch (DataAccessException ex) {
            throw PersistenceException.of("load profiles", ex);
        }
        var profiles = new ArrayList<TariffProfile>(rows.size());
        for (var row : rows) {
            toDomain(row).ifPresent(profiles::add);
        }
        return profiles;
    }

    // an unreadable row is skipped so the remaining users are still checked
    private Optional<TariffProfile> toDomain(TariffProfileEntity row) {
        try {
            return Optional.of(mapper.toDomain(row));
        } catch (JacksonException | IllegalArgumentException ex) {
            log.error("profile.unreadable: user_id={}, reason={}", row.getUserId(), ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    @Override
    @Transactional
    public void delete(String userId) {
        try {
            jpaRepository.deleteById(userId);
        } catch (DataAccessException ex) {
            throw PersistenceException.of("delete profile", userId, ex);
        }
    }
}
